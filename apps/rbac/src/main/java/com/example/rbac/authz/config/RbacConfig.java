package com.example.rbac.authz.config;

import com.example.rbac.authz.catalog.PermissionCatalog;
import com.example.rbac.authz.hierarchy.RoleHierarchy;
import com.example.rbac.authz.predicate.AsyncPermissionPredicate;
import com.example.rbac.authz.predicate.ClientTeamDirectory;
import com.example.rbac.authz.predicate.ConfiguredPermissionPredicate;
import com.example.rbac.authz.predicate.PermissionPredicate;
import com.example.rbac.authz.predicate.PredicateRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the immutable catalog and predicate table from configuration.
 * Any invalid entry fails application startup.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RbacProperties.class)
public class RbacConfig {

    @Bean
    public PermissionCatalog permissionCatalog(RbacProperties properties) {
        PermissionCatalog catalog = PermissionCatalog.fromConfig(properties.catalog());
        log.info("Loaded permission catalog: {}", catalog);
        return catalog;
    }

    @Bean
    public ClientTeamDirectory clientTeamDirectory(RbacProperties properties) {
        ClientTeamDirectory directory = ClientTeamDirectory.fromConfig(properties.clientTeams());
        log.info("Loaded client team directory with {} clients", directory.size());
        return directory;
    }

    @Bean
    public PredicateRegistry predicateRegistry(
            RbacProperties properties,
            RoleHierarchy hierarchy,
            PermissionCatalog catalog,
            ObjectProvider<PermissionPredicate> predicateBeans,
            ObjectProvider<AsyncPermissionPredicate> asyncPredicateBeans) {

        List<PermissionPredicate> predicates = new ArrayList<>();
        properties.predicates().stream()
                .map(definition -> new ConfiguredPermissionPredicate(definition, hierarchy))
                .forEach(predicates::add);
        predicateBeans.orderedStream().forEach(predicates::add);

        PredicateRegistry registry = PredicateRegistry.of(predicates, asyncPredicateBeans.orderedStream().toList());
        registry.validateAgainst(catalog);

        log.info("Loaded {} permission predicates", registry.size());
        registry.getPredicates().forEach(p -> log.debug("  - {}: {}", p.getPermission(), p.getDescription()));
        return registry;
    }
}
