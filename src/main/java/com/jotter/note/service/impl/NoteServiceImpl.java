package com.jotter.note.service.impl;

import com.jotter.common.exception.BusinessException;
import com.jotter.common.exception.ErrorCode;
import com.jotter.note.api.dto.CreateNoteRequest;
import com.jotter.note.api.dto.NoteResponse;
import com.jotter.note.domain.Note;
import com.jotter.note.mapper.NoteMapper;
import com.jotter.note.service.NoteService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 笔记服务实现。
 *
 * <p>错误处理：删除不存在或不属于当前用户的笔记返回 {@link ErrorCode#NOTE_NOT_FOUND}，
 * 存储异常统一转为 {@link ErrorCode#STORE_UNAVAILABLE}。</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NoteServiceImpl implements NoteService {

    private final NoteMapper noteMapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public List<NoteResponse> list(long userId) {
        try {
            return noteMapper.listByUser(userId).stream()
                    .map(NoteServiceImpl::toResponse)
                    .toList();
        } catch (DataAccessException ex) {
            throw new BusinessException(ErrorCode.STORE_UNAVAILABLE, ex);
        }
    }

    @Override
    @Transactional
    public NoteResponse create(long userId, CreateNoteRequest request) {
        Instant now = Instant.now(clock);
        Note note = Note.builder()
                .userId(userId)
                .title(request.title().trim())
                .content(request.content().trim())
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            noteMapper.insert(note);
        } catch (DataAccessException ex) {
            throw new BusinessException(ErrorCode.STORE_UNAVAILABLE, ex);
        }
        log.info("Note created id={} uid={}", note.getId(), userId);
        return toResponse(note);
    }

    @Override
    @Transactional
    public void delete(long userId, long noteId) {
        int deleted;
        try {
            deleted = noteMapper.deleteByIdAndUser(noteId, userId);
        } catch (DataAccessException ex) {
            throw new BusinessException(ErrorCode.STORE_UNAVAILABLE, ex);
        }
        if (deleted == 0) {
            throw new BusinessException(ErrorCode.NOTE_NOT_FOUND);
        }
    }

    private static NoteResponse toResponse(Note note) {
        return new NoteResponse(note.getId(), note.getTitle(), note.getContent(), note.getCreatedAt(), note.getUpdatedAt());
    }
}
