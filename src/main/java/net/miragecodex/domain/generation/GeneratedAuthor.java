package net.miragecodex.domain.generation;

public record GeneratedAuthor(String penName, String stylePrompt, String bio) {
}
