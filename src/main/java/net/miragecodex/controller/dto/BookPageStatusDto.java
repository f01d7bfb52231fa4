package net.miragecodex.controller.dto;

import jakarta.annotation.Nullable;

/**
 * Whether a page has been written, with its text when it has.
 */
public record BookPageStatusDto(boolean exists, @Nullable String content) {
}
