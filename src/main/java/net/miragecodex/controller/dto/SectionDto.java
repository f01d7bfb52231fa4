package net.miragecodex.controller.dto;

import net.miragecodex.domain.book.BookSection;

public record SectionDto(String title, int fromPage, int toPage, String summary) {

    public static SectionDto fromSection(BookSection section) {
        return new SectionDto(section.title(), section.fromPage(), section.toPage(), section.summary());
    }
}
