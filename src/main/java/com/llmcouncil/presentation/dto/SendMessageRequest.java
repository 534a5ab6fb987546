package com.llmcouncil.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of a message request.
 */
public record SendMessageRequest(@NotBlank String content) {
}
