package com.userservice.domain.model;

import com.userservice.domain.exception.ErrorCode;
import com.userservice.domain.exception.ServiceException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Domain model representing a user.
 *
 * The identifier and timestamps are assigned by the primary store on write;
 * a user built from input carries only what the caller supplied.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class User {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private UUID id;
    private String email;
    private Instant createdAt;
    private Instant updatedAt;

    public static User newUser(String email) {
        return User.builder().email(email).build();
    }

    public static User withId(UUID id, String email) {
        return User.builder().id(id).email(email).build();
    }

    public void validate() {
        if (email == null || email.isBlank()) {
            throw new ServiceException(ErrorCode.VALIDATION_FAILED, "email is required");
        }
        if (!EMAIL.matcher(email).matches()) {
            throw new ServiceException(ErrorCode.VALIDATION_FAILED, "email is malformed: " + email);
        }
    }
}
