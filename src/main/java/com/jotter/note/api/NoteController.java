package com.jotter.note.api;

import com.jotter.auth.token.JwtService;
import com.jotter.common.api.MessageResponse;
import com.jotter.note.api.dto.CreateNoteRequest;
import com.jotter.note.api.dto.NoteResponse;
import com.jotter.note.service.NoteService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 笔记接口。
 *
 * <p>鉴权：依赖 Spring Security Resource Server 注入 {@link Jwt}，用户 ID 只从令牌中解析，不接受前端传入。</p>
 */
@RestController
@RequestMapping("/api/notes")
@Validated
@RequiredArgsConstructor
public class NoteController {

    private final NoteService noteService;
    private final JwtService jwtService;

    @GetMapping
    public List<NoteResponse> list(@AuthenticationPrincipal Jwt jwt) {
        return noteService.list(jwtService.extractUserId(jwt));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public NoteResponse create(@AuthenticationPrincipal Jwt jwt,
                               @Valid @RequestBody CreateNoteRequest request) {
        return noteService.create(jwtService.extractUserId(jwt), request);
    }

    @DeleteMapping("/{id}")
    public MessageResponse delete(@AuthenticationPrincipal Jwt jwt, @PathVariable("id") long id) {
        noteService.delete(jwtService.extractUserId(jwt), id);
        return new MessageResponse("Note deleted successfully");
    }
}
