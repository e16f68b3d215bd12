package com.dailycode.interfaces.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record SubscribeRequest(
        @NotBlank(message = "Please enter an e-mail address")
        @Email(message = "Not a valid e-mail address")
        String email,

        String language,

        String difficulty
) {}
