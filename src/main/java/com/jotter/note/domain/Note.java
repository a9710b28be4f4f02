package com.jotter.note.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Note {

    private Long id;
    private Long userId;
    private String title;
    private String content;
    private Instant createdAt;
    private Instant updatedAt;
}
