package com.questhub.engineservice.support;

import com.questhub.engineservice.application.ai.NarrativeService;
import com.questhub.engineservice.application.command.CommandPipeline;
import com.questhub.engineservice.application.session.SessionCache;
import com.questhub.engineservice.application.session.SessionMaintenance;
import com.questhub.engineservice.application.session.UndoHistory;
import com.questhub.engineservice.combat.CombatCalculator;
import com.questhub.engineservice.combat.CombatManager;
import com.questhub.engineservice.combat.EnemyAI;
import com.questhub.engineservice.combat.EnemyTemplates;
import com.questhub.engineservice.combat.InitiativeSystem;
import com.questhub.engineservice.command.CommandRegistry;
import com.questhub.engineservice.command.CommandValidator;
import com.questhub.engineservice.command.CooldownTracker;
import com.questhub.engineservice.command.impl.AttackCommand;
import com.questhub.engineservice.command.impl.CastSpellCommand;
import com.questhub.engineservice.command.impl.CombatSettlement;
import com.questhub.engineservice.command.impl.DefendCommand;
import com.questhub.engineservice.command.impl.FleeCommand;
import com.questhub.engineservice.command.impl.GenerateImageCommand;
import com.questhub.engineservice.command.impl.GenerateNarrativeCommand;
import com.questhub.engineservice.command.impl.MoveCommand;
import com.questhub.engineservice.command.impl.RespawnCommand;
import com.questhub.engineservice.command.impl.RestCommand;
import com.questhub.engineservice.command.impl.StartCombatCommand;
import com.questhub.engineservice.command.impl.UseItemCommand;
import com.questhub.engineservice.config.EngineProperties;
import com.questhub.engineservice.infrastructure.memory.InMemoryCharacterRepository;
import com.questhub.engineservice.infrastructure.memory.InMemorySessionRepository;
import com.questhub.engineservice.lock.LockStoreType;
import com.questhub.engineservice.lock.impl.LocalSessionLock;
import com.questhub.engineservice.service.impl.GameEngineImpl;
import com.questhub.engineservice.service.metrics.EngineMetrics;

import java.util.List;
import java.util.concurrent.ScheduledExecutorService;

import static org.mockito.Mockito.mock;

/**
 * 不依赖 Spring 容器与 Redis 的完整引擎装配：本地锁 + 内存仓储 + 可拨动时钟，AI 服务为 mock。
 */
public class EngineFixture {

    public final EngineProperties properties;
    public final MutableClock clock = new MutableClock(1_700_000_000_000L);
    public final InMemorySessionRepository sessionRepository = new InMemorySessionRepository();
    public final InMemoryCharacterRepository characterRepository = new InMemoryCharacterRepository();
    public final EngineMetrics metrics = new EngineMetrics();
    public final NarrativeService narrativeService = mock(NarrativeService.class);
    public final LocalSessionLock lock;
    public final SessionCache cache;
    public final SessionMaintenance maintenance;
    public final GameEngineImpl engine;

    public EngineFixture() {
        this(new EngineProperties());
    }

    public EngineFixture(EngineProperties properties) {
        this.properties = properties;
        properties.setLockStore(LockStoreType.LOCAL);
        properties.setPersistenceEnabled(false);

        lock = new LocalSessionLock(properties, clock);
        cache = new SessionCache(sessionRepository, properties, metrics);
        maintenance = new SessionMaintenance(cache, lock, properties, clock);

        EnemyTemplates templates = new EnemyTemplates();
        CombatCalculator calculator = new CombatCalculator();
        CombatManager combatManager = new CombatManager(new InitiativeSystem(),
                new EnemyAI(templates, properties), calculator, templates);
        CombatSettlement settlement = new CombatSettlement(combatManager);

        CommandRegistry registry = new CommandRegistry(List.of(
                new MoveCommand(),
                new RestCommand(),
                new UseItemCommand(),
                new RespawnCommand(),
                new StartCombatCommand(combatManager, settlement),
                new AttackCommand(combatManager, settlement),
                new DefendCommand(combatManager, settlement),
                new FleeCommand(combatManager, settlement),
                new CastSpellCommand(combatManager, settlement, calculator),
                new GenerateImageCommand(narrativeService, properties),
                new GenerateNarrativeCommand(narrativeService, properties)));

        CooldownTracker cooldowns = new CooldownTracker();
        engine = new GameEngineImpl(cache, sessionRepository, characterRepository, lock, registry,
                new CommandPipeline(new CommandValidator(), cooldowns),
                new UndoHistory(properties), cooldowns, maintenance, metrics, properties, clock,
                mock(ScheduledExecutorService.class));
    }
}
