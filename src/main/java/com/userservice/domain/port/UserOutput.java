package com.userservice.domain.port;

import com.userservice.domain.model.User;
import lombok.Value;

/**
 * Result of create, get and update.
 */
@Value
public class UserOutput {
    User user;
}
