package com.jotter.note.service;

import com.jotter.note.api.dto.CreateNoteRequest;
import com.jotter.note.api.dto.NoteResponse;

import java.util.List;

/**
 * 笔记服务：所有操作都限定在当前登录用户自己的笔记范围内。
 */
public interface NoteService {

    List<NoteResponse> list(long userId);

    NoteResponse create(long userId, CreateNoteRequest request);

    void delete(long userId, long noteId);
}
