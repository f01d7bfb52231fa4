package net.miragecodex.domain.catalog;

import jakarta.annotation.Nullable;

public record Tag(String slug, String label, @Nullable String promptBoost) {
}
