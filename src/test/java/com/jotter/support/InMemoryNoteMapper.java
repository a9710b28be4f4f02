package com.jotter.support;

import com.jotter.note.domain.Note;
import com.jotter.note.mapper.NoteMapper;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryNoteMapper implements NoteMapper {

    private final List<Note> rows = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public List<Note> listByUser(Long userId) {
        return rows.stream()
                .filter(n -> Objects.equals(n.getUserId(), userId))
                .sorted(Comparator.comparing(Note::getCreatedAt).thenComparing(Note::getId).reversed())
                .toList();
    }

    @Override
    public int insert(Note note) {
        note.setId(sequence.incrementAndGet());
        rows.add(note);
        return 1;
    }

    @Override
    public int deleteByIdAndUser(Long id, Long userId) {
        boolean removed = rows.removeIf(n -> Objects.equals(n.getId(), id) && Objects.equals(n.getUserId(), userId));
        return removed ? 1 : 0;
    }
}
