package com.maildesk.config;

import com.maildesk.mapper.SeenMessageMapper;
import com.maildesk.mapper.TicketIdentityMapper;
import com.maildesk.store.DatabaseSeenMessageStore;
import com.maildesk.store.DatabaseTicketIdentityRegistry;
import com.maildesk.store.InstanceLock;
import com.maildesk.store.JsonFileSeenMessageStore;
import com.maildesk.store.JsonFileTicketIdentityRegistry;
import com.maildesk.store.SeenMessageStore;
import com.maildesk.store.TicketIdentityRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Seen-message store and identity registry backends.
 * Both are loaded in full here; a load failure fails application startup.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class StateStoreConfig {

    private final MailDeskProperties properties;

    @Bean(destroyMethod = "close")
    public InstanceLock instanceLock() throws Exception {
        InstanceLock lock = new InstanceLock(statePath(properties.getState().getLockFile()));
        lock.acquire();
        return lock;
    }

    @Bean
    @DependsOn({"dataSourceInitializer", "instanceLock"})
    @ConditionalOnProperty(name = "maildesk.state.backend", havingValue = "database", matchIfMissing = true)
    public SeenMessageStore databaseSeenMessageStore(SeenMessageMapper mapper) {
        DatabaseSeenMessageStore store = new DatabaseSeenMessageStore(mapper);
        store.load();
        return store;
    }

    @Bean
    @DependsOn({"dataSourceInitializer", "instanceLock"})
    @ConditionalOnProperty(name = "maildesk.state.backend", havingValue = "database", matchIfMissing = true)
    public TicketIdentityRegistry databaseTicketIdentityRegistry(TicketIdentityMapper mapper) {
        DatabaseTicketIdentityRegistry registry = new DatabaseTicketIdentityRegistry(mapper);
        registry.load();
        return registry;
    }

    @Bean
    @DependsOn("instanceLock")
    @ConditionalOnProperty(name = "maildesk.state.backend", havingValue = "file")
    public SeenMessageStore fileSeenMessageStore() {
        JsonFileSeenMessageStore store = new JsonFileSeenMessageStore(statePath(properties.getState().getSeenFile()));
        store.load();
        return store;
    }

    @Bean
    @DependsOn("instanceLock")
    @ConditionalOnProperty(name = "maildesk.state.backend", havingValue = "file")
    public TicketIdentityRegistry fileTicketIdentityRegistry() {
        JsonFileTicketIdentityRegistry registry =
                new JsonFileTicketIdentityRegistry(statePath(properties.getState().getIdentityFile()));
        registry.load();
        return registry;
    }

    private Path statePath(String filename) {
        return Paths.get(properties.getState().getDirectory(), filename);
    }
}
