package net.miragecodex.controller.dto;

import net.miragecodex.domain.book.AuthorProfile;

public record AuthorDto(String id, String penName, String bio) {

    public static AuthorDto fromProfile(AuthorProfile author) {
        return new AuthorDto(author.id().toString(), author.penName(), author.bio());
    }
}
