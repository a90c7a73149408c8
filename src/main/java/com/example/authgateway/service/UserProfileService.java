package com.example.authgateway.service;

import com.example.authgateway.adapter.datastore.DataClient;
import com.example.authgateway.domain.entity.UserProfile;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Reads rows of {@code user_profiles}. Always called with a user-scoped client, so a
 * caller can only ever see their own row.
 */
@Service
public class UserProfileService {

  public static final String PROFILE_TABLE = "user_profiles";

  public Optional<UserProfile> findProfile(DataClient client, String userId) {
    return client.selectOne(PROFILE_TABLE, Map.of("id", userId), UserProfile.class);
  }
}
