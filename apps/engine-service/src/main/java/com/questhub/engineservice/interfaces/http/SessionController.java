package com.questhub.engineservice.interfaces.http;

import com.questhub.engineservice.command.CommandResult;
import com.questhub.engineservice.command.CommandType;
import com.questhub.engineservice.common.error.SessionAccessDeniedException;
import com.questhub.engineservice.domain.model.GameSession;
import com.questhub.engineservice.interfaces.http.dto.CreateSessionRequest;
import com.questhub.engineservice.interfaces.http.dto.ExecuteCommandRequest;
import com.questhub.engineservice.lock.SessionLockInfo;
import com.questhub.engineservice.service.GameEngine;
import com.questhub.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 会话 HTTP 接口。调用方身份取自请求头 X-User-Id（由网关写入）。
 * 失败统一由 WebExceptionAdvice 映射。
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

    static final String USER_HEADER = "X-User-Id";

    private final GameEngine engine;

    /**
     * 新建会话。
     */
    @PostMapping
    public ResponseEntity<ApiResponse<GameSession>> create(@RequestHeader(USER_HEADER) String userId,
                                                           @RequestBody(required = false) CreateSessionRequest req) {
        CreateSessionRequest r = req == null ? new CreateSessionRequest() : req;
        GameSession session = engine.createSession(userId, r.getCharacterId(), r.getCharacterName(), r.getSettings());
        return ResponseEntity.ok(ApiResponse.success(session));
    }

    /**
     * 会话全量只读快照，只允许所属用户查看。
     */
    @GetMapping("/{sessionId}")
    public ResponseEntity<ApiResponse<GameSession>> get(@PathVariable String sessionId,
                                                        @RequestHeader(USER_HEADER) String userId) {
        GameSession session = engine.getSession(sessionId);
        if (!session.isOwnedBy(userId)) {
            throw new SessionAccessDeniedException();
        }
        return ResponseEntity.ok(ApiResponse.success(session));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<GameSession>>> mine(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(ApiResponse.success(engine.getUserSessions(userId)));
    }

    /**
     * 执行命令。会话正被其他请求占用时返回 409 + retryable，客户端退避重试。
     */
    @PostMapping("/{sessionId}/commands")
    public ResponseEntity<ApiResponse<CommandResult>> execute(@PathVariable String sessionId,
                                                              @RequestHeader(USER_HEADER) String userId,
                                                              @RequestBody ExecuteCommandRequest req) {
        CommandType type = CommandType.fromCode(req.getType());
        CommandResult result = engine.executeCommand(sessionId, type, req.getParameters(), userId);
        return ResponseEntity.ok(ApiResponse.success(result.getMessage(), result));
    }

    @PostMapping("/{sessionId}/undo")
    public ResponseEntity<ApiResponse<CommandResult>> undo(@PathVariable String sessionId,
                                                           @RequestHeader(USER_HEADER) String userId) {
        CommandResult result = engine.undoCommand(sessionId, userId);
        return ResponseEntity.ok(ApiResponse.success(result.getMessage(), result));
    }

    @PostMapping("/{sessionId}/redo")
    public ResponseEntity<ApiResponse<CommandResult>> redo(@PathVariable String sessionId,
                                                           @RequestHeader(USER_HEADER) String userId) {
        CommandResult result = engine.redoCommand(sessionId, userId);
        return ResponseEntity.ok(ApiResponse.success(result.getMessage(), result));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<ApiResponse<Void>> end(@PathVariable String sessionId,
                                                 @RequestHeader(USER_HEADER) String userId) {
        engine.endSession(sessionId, userId);
        return ResponseEntity.ok(ApiResponse.success());
    }

    /**
     * 锁状态（运维排查）。未加锁时 data 为空。
     */
    @GetMapping("/{sessionId}/lock")
    public ResponseEntity<ApiResponse<SessionLockInfo>> lock(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.success(engine.getSessionLockInfo(sessionId).orElse(null)));
    }

    /**
     * 强制释放会话锁（运维恢复）。
     */
    @DeleteMapping("/{sessionId}/lock")
    public ResponseEntity<ApiResponse<Boolean>> forceRelease(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.success(engine.forceReleaseSessionLock(sessionId)));
    }
}
