package com.example.ocppcentral.repository;

import com.example.ocppcentral.model.AppUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    Optional<AppUser> findByRfidCardId(String rfidCardId);
}
