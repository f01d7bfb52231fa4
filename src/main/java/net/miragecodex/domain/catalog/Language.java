package net.miragecodex.domain.catalog;

public record Language(int id, String code, String label) {
}
