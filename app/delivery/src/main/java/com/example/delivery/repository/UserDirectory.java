package com.example.delivery.repository;

import com.example.delivery.model.UserProfile;
import java.util.Optional;

/** Lookup of users and their notification preferences. */
public interface UserDirectory {

  Optional<UserProfile> findById(String userId);

  Optional<UserProfile> findByEmail(String email);
}
