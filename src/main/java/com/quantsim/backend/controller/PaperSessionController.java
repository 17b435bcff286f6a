package com.quantsim.backend.controller;

import com.quantsim.backend.dto.SessionStartRequest;
import com.quantsim.backend.model.LiveSessionState;
import com.quantsim.backend.service.live.LivePaperSessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/paper/sessions")
@RequiredArgsConstructor
public class PaperSessionController {

    private final LivePaperSessionService sessionService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public LiveSessionState start(@Valid @RequestBody SessionStartRequest request) {
        return sessionService.start(request);
    }

    @GetMapping
    public List<LiveSessionState> list() {
        return sessionService.list();
    }

    @GetMapping("/{id}")
    public LiveSessionState status(@PathVariable String id) {
        return sessionService.status(id);
    }

    @DeleteMapping("/{id}")
    public LiveSessionState stop(@PathVariable String id) {
        return sessionService.stop(id);
    }
}
