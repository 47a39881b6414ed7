package com.userservice.domain.port;

import com.userservice.domain.model.User;
import lombok.Value;

import java.util.List;

@Value
public class ListUserOutput {
    List<User> users;
}
