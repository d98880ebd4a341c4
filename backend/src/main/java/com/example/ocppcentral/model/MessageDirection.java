package com.example.ocppcentral.model;

public enum MessageDirection {
    IN,
    OUT
}
