package com.example.ocppcentral.service;

import com.example.ocppcentral.model.AppUser;
import com.example.ocppcentral.model.Vehicle;
import com.example.ocppcentral.repository.AppUserRepository;
import com.example.ocppcentral.repository.VehicleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AppUserService {

    private final AppUserRepository userRepository;
    private final VehicleRepository vehicleRepository;

    public Optional<AppUser> findByIdTag(String idTag) {
        return userRepository.findByRfidCardId(idTag);
    }

    @Transactional
    public Vehicle getOrCreateVehicle(AppUser user) {
        return vehicleRepository.findFirstByUserIdOrderByIdAsc(user.getId())
                .orElseGet(() -> {
                    log.info("Creating default vehicle for user {}", user.getId());
                    return vehicleRepository.save(Vehicle.builder()
                            .userId(user.getId())
                            .make("Unknown")
                            .model("Unknown")
                            .build());
                });
    }
}
