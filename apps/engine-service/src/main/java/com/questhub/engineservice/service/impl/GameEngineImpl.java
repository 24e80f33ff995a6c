package com.questhub.engineservice.service.impl;

import com.questhub.engineservice.application.command.CommandExecution;
import com.questhub.engineservice.application.command.CommandPipeline;
import com.questhub.engineservice.application.session.SessionCache;
import com.questhub.engineservice.application.session.SessionMaintenance;
import com.questhub.engineservice.application.session.UndoHistory;
import com.questhub.engineservice.command.CommandRegistry;
import com.questhub.engineservice.command.CommandResult;
import com.questhub.engineservice.command.CommandType;
import com.questhub.engineservice.command.CooldownTracker;
import com.questhub.engineservice.command.GameCommand;
import com.questhub.engineservice.common.error.EngineException;
import com.questhub.engineservice.common.error.InternalEngineException;
import com.questhub.engineservice.common.error.LockBusyException;
import com.questhub.engineservice.common.error.NothingToRedoException;
import com.questhub.engineservice.common.error.NothingToUndoException;
import com.questhub.engineservice.common.error.SessionAccessDeniedException;
import com.questhub.engineservice.common.error.SessionLimitReachedException;
import com.questhub.engineservice.common.error.SessionNotFoundException;
import com.questhub.engineservice.config.EngineProperties;
import com.questhub.engineservice.domain.constants.EngineMessages;
import com.questhub.engineservice.domain.model.CharacterState;
import com.questhub.engineservice.domain.model.GameSession;
import com.questhub.engineservice.domain.model.GameState;
import com.questhub.engineservice.domain.model.LogEntry;
import com.questhub.engineservice.domain.model.SessionSettings;
import com.questhub.engineservice.domain.model.StateDelta;
import com.questhub.engineservice.domain.model.UndoEntry;
import com.questhub.engineservice.domain.repository.CharacterRepository;
import com.questhub.engineservice.domain.repository.SessionRepository;
import com.questhub.engineservice.lock.SessionLock;
import com.questhub.engineservice.lock.SessionLockInfo;
import com.questhub.engineservice.service.GameEngine;
import com.questhub.engineservice.service.event.EngineEventListener;
import com.questhub.engineservice.service.event.EngineEventPublisher;
import com.questhub.engineservice.service.metrics.EngineMetrics;
import com.questhub.engineservice.service.metrics.MetricsSnapshot;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * GameEngineImpl
 * -------------------------------------------------------
 * 引擎根组件。所有修改会话的操作（命令、撤销、重做、结束）都走同一条路径：
 *   1) 获取会话锁（失败立即抛 LockBusy，不排队）；
 *   2) 以存储为准加载会话，校验归属；
 *   3) 在工作副本上执行，成功后一次性提交并保存；
 *   4) finally 释放锁。
 * 锁外只做指标统计和事件回调。
 */
@Slf4j
@Service
public class GameEngineImpl implements GameEngine {

    private final SessionCache cache;
    private final SessionRepository sessionRepository;
    private final CharacterRepository characterRepository;
    private final SessionLock sessionLock;
    private final CommandRegistry registry;
    private final CommandPipeline pipeline;
    private final UndoHistory undoHistory;
    private final CooldownTracker cooldowns;
    private final SessionMaintenance maintenance;
    private final EngineMetrics metrics;
    private final EngineProperties properties;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    private final EngineEventPublisher events = new EngineEventPublisher();
    private final List<ScheduledFuture<?>> jobs = new ArrayList<>();
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public GameEngineImpl(SessionCache cache,
                          SessionRepository sessionRepository,
                          CharacterRepository characterRepository,
                          SessionLock sessionLock,
                          CommandRegistry registry,
                          CommandPipeline pipeline,
                          UndoHistory undoHistory,
                          CooldownTracker cooldowns,
                          SessionMaintenance maintenance,
                          EngineMetrics metrics,
                          EngineProperties properties,
                          Clock clock,
                          @Qualifier("engineMaintenanceScheduler") ScheduledExecutorService scheduler) {
        this.cache = cache;
        this.sessionRepository = sessionRepository;
        this.characterRepository = characterRepository;
        this.sessionLock = sessionLock;
        this.registry = registry;
        this.pipeline = pipeline;
        this.undoHistory = undoHistory;
        this.cooldowns = cooldowns;
        this.maintenance = maintenance;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
        this.scheduler = scheduler;
    }

    /**
     * 容器中声明的监听器在启动时自动注册。
     */
    @Autowired(required = false)
    public void setListeners(List<EngineEventListener> listeners) {
        listeners.forEach(events::add);
    }

    /**
     * 启动后台任务：自动保存、清理不活跃会话与过期本地锁。
     */
    @PostConstruct
    public void start() {
        jobs.add(scheduler.scheduleAtFixedRate(guarded("autosave", maintenance::autoSave),
                properties.getAutoSaveIntervalSeconds(), properties.getAutoSaveIntervalSeconds(), TimeUnit.SECONDS));
        jobs.add(scheduler.scheduleAtFixedRate(guarded("cleanup", () -> {
                    maintenance.cleanupInactive();
                    maintenance.cleanupExpiredLocks();
                }),
                properties.getCleanupIntervalSeconds(), properties.getCleanupIntervalSeconds(), TimeUnit.SECONDS));
        log.info("会话引擎已启动: autosave={}s, cleanup={}s, maxSessions={}",
                properties.getAutoSaveIntervalSeconds(), properties.getCleanupIntervalSeconds(),
                properties.getMaxConcurrentSessions());
    }

    // ========== 会话生命周期 ==========

    @Override
    public GameSession createSession(String userId, String characterId, String characterName, SessionSettings settings) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId 不能为空");
        }
        if (cache.size() >= properties.getMaxConcurrentSessions()) {
            throw new SessionLimitReachedException(properties.getMaxConcurrentSessions());
        }
        String cid = characterId == null || characterId.isBlank() ? "char-" + UUID.randomUUID() : characterId;
        CharacterState character = characterRepository.findById(cid).orElseGet(() -> {
            CharacterState c = CharacterState.newCharacter(cid, characterName);
            characterRepository.save(c);
            return c;
        });

        SessionSettings s = settings == null ? new SessionSettings() : settings;
        long now = clock.millis();
        GameState state = new GameState();
        state.setCharacter(character);
        state.setRngSeed(s.getSeed() != null ? s.getSeed() : ThreadLocalRandom.current().nextLong());

        GameSession session = new GameSession();
        session.setSessionId(UUID.randomUUID().toString());
        session.setUserId(userId);
        session.setCharacterId(cid);
        session.setState(state);
        session.setSettings(s);
        session.setCreatedAt(now);
        session.setLastActivity(now);
        session.getEventHistory().add(LogEntry.system(EngineMessages.SESSION_CREATED));

        cache.put(session);
        cache.persist(session, now);
        metrics.sessionCreated();
        events.sessionCreated(session);
        log.info("会话已创建: sessionId={}, userId={}, characterId={}", session.getSessionId(), userId, cid);
        return session;
    }

    @Override
    public GameSession getSession(String sessionId) {
        return cache.find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    @Override
    public List<GameSession> getUserSessions(String userId) {
        return sessionRepository.findIdsByUser(userId).stream()
                .map(cache::find)
                .flatMap(Optional::stream)
                .toList();
    }

    @Override
    public void endSession(String sessionId, String userId) {
        sessionLock.withLock(sessionId, lockTtl(), () -> {
            GameSession session = loadOwned(sessionId, userId);
            characterRepository.save(session.getState().getCharacter());
            session.setActive(false);
            cache.delete(session);
            return null;
        });
        log.info("会话已结束: sessionId={}, userId={}", sessionId, userId);
    }

    // ========== 命令 ==========

    @Override
    public CommandResult executeCommand(String sessionId, CommandType type, Map<String, Object> parameters, String userId) {
        GameCommand command = registry.get(type);
        return locked(sessionId, type, () -> {
            GameSession session = loadOwned(sessionId, userId);
            long now = clock.millis();
            CommandExecution execution = pipeline.run(session, command, parameters, now);
            return commit(session, execution, now);
        });
    }

    @Override
    public CommandResult undoCommand(String sessionId, String userId) {
        return locked(sessionId, null, () -> {
            GameSession session = loadOwned(sessionId, userId);
            UndoEntry entry = undoHistory.peekUndo(session);
            // 不可撤销的条目不会入栈，这里再挡一次
            if (entry == null || !entry.isUndoable()) {
                throw new NothingToUndoException();
            }
            GameState reverted = session.getState().copy();
            entry.getDelta().revert(reverted);
            session.setState(reverted);
            undoHistory.moveToRedo(session);
            return reversal(session, entry, EngineMessages.formatUndone(entry.getCommandType()));
        });
    }

    @Override
    public CommandResult redoCommand(String sessionId, String userId) {
        return locked(sessionId, null, () -> {
            GameSession session = loadOwned(sessionId, userId);
            UndoEntry entry = undoHistory.peekRedo(session);
            if (entry == null || !entry.isUndoable()) {
                throw new NothingToRedoException();
            }
            GameState reapplied = session.getState().copy();
            entry.getDelta().reapply(reapplied);
            session.setState(reapplied);
            undoHistory.moveToUndo(session);
            return reversal(session, entry, EngineMessages.formatRedone(entry.getCommandType()));
        });
    }

    // ========== 锁与指标 ==========

    @Override
    public boolean isSessionLocked(String sessionId) {
        return sessionLock.isLocked(sessionId);
    }

    @Override
    public Optional<SessionLockInfo> getSessionLockInfo(String sessionId) {
        return sessionLock.getLockInfo(sessionId);
    }

    @Override
    public boolean forceReleaseSessionLock(String sessionId) {
        boolean released = sessionLock.forceRelease(sessionId);
        log.info("强制释放会话锁: sessionId={}, released={}", sessionId, released);
        return released;
    }

    @Override
    public MetricsSnapshot getMetrics() {
        return metrics.snapshot(cache.size());
    }

    @Override
    public void addListener(EngineEventListener listener) {
        events.add(listener);
    }

    @Override
    public void removeListener(EngineEventListener listener) {
        events.remove(listener);
    }

    @Override
    @PreDestroy
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        jobs.forEach(f -> f.cancel(false));
        jobs.clear();
        int saved = maintenance.saveAll();
        cache.clear();
        log.info("会话引擎已停止: savedOnShutdown={}", saved);
    }

    // ========== 内部 ==========

    /**
     * 持锁执行一次修改操作，并在锁外统计指标、发送事件。
     */
    private CommandResult locked(String sessionId, CommandType type, Supplier<CommandResult> action) {
        long start = System.nanoTime();
        try {
            CommandResult result = sessionLock.withLock(sessionId, lockTtl(), action);
            metrics.commandSucceeded(System.nanoTime() - start);
            events.commandExecuted(sessionId, result.getCommandType(), result);
            return result;
        } catch (LockBusyException e) {
            log.debug("会话正忙，拒绝执行: sessionId={}, type={}", sessionId, type);
            metrics.lockBusy();
            metrics.commandFailed();
            events.commandFailed(sessionId, type, e);
            throw e;
        } catch (EngineException e) {
            log.debug("命令被拒绝: sessionId={}, type={}, code={}", sessionId, type, e.getCode());
            metrics.commandFailed();
            events.commandFailed(sessionId, type, e);
            throw e;
        } catch (RuntimeException e) {
            log.error("引擎内部错误: sessionId={}, type={}", sessionId, type, e);
            InternalEngineException wrapped = new InternalEngineException(e);
            metrics.commandFailed();
            events.commandFailed(sessionId, type, wrapped);
            throw wrapped;
        }
    }

    private GameSession loadOwned(String sessionId, String userId) {
        GameSession session = cache.loadForUpdate(sessionId);
        if (!session.isOwnedBy(userId)) {
            throw new SessionAccessDeniedException();
        }
        return session;
    }

    /**
     * 提交：替换状态 → 记录撤销条目 → 记录冷却 → 追加事件历史 → 版本 +1 → 保存。
     */
    private CommandResult commit(GameSession session, CommandExecution execution, long now) {
        CommandResult result = execution.result();
        StateDelta delta = StateDelta.between(session.getState(), execution.workingState());
        session.setState(execution.workingState());

        UndoEntry entry = new UndoEntry();
        entry.setEntryId(UUID.randomUUID().toString());
        entry.setCommandType(result.getCommandType().code());
        entry.setUndoable(execution.undoable());
        entry.setDelta(delta);
        entry.setCreatedAt(now);
        undoHistory.record(session, entry);

        cooldowns.record(session, session.getState().getCharacter().getId(), result.getCommandType(), now);
        appendHistory(session, result.getLogEntries());
        touch(session, now);
        result.setDelta(delta);
        return result;
    }

    private CommandResult reversal(GameSession session, UndoEntry entry, String message) {
        long now = clock.millis();
        LogEntry logEntry = LogEntry.system(message);
        appendHistory(session, List.of(logEntry));
        touch(session, now);
        return CommandResult.builder()
                .commandType(CommandType.fromCode(entry.getCommandType()))
                .success(true)
                .message(message)
                .delta(entry.getDelta())
                .logEntry(logEntry)
                .build();
    }

    private void touch(GameSession session, long now) {
        session.setVersion(session.getVersion() + 1);
        session.setLastActivity(now);
        cache.persist(session, now);
    }

    private void appendHistory(GameSession session, List<LogEntry> entries) {
        List<LogEntry> history = session.getEventHistory();
        history.addAll(entries);
        int overflow = history.size() - properties.getMaxEventHistorySize();
        if (overflow > 0) {
            history.subList(0, overflow).clear();
        }
    }

    private Duration lockTtl() {
        return Duration.ofSeconds(properties.getLockTtlSeconds());
    }

    private Runnable guarded(String job, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("后台任务执行失败: job={}", job, e);
            }
        };
    }
}
