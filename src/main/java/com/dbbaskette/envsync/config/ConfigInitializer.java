package com.dbbaskette.envsync.config;

import com.dbbaskette.envsync.model.ExclusionPattern;
import com.dbbaskette.envsync.model.ProjectRepo;
import com.dbbaskette.envsync.repository.ExclusionPatternRepository;
import com.dbbaskette.envsync.repository.ProjectRepoRepository;
import com.dbbaskette.envsync.service.classify.ExclusionRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mirrors configured projects and exclusion patterns into the database on startup.
 * Existing rows are updated in place; nothing is deleted.
 */
@Component
public class ConfigInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ConfigInitializer.class);

    private final EnvSyncProperties properties;
    private final ProjectRepoRepository projectRepository;
    private final ExclusionPatternRepository exclusionRepository;

    public ConfigInitializer(EnvSyncProperties properties, ProjectRepoRepository projectRepository,
                             ExclusionPatternRepository exclusionRepository) {
        this.properties = properties;
        this.projectRepository = projectRepository;
        this.exclusionRepository = exclusionRepository;
    }

    @Override
    public void run(ApplicationArguments args) {
        syncGlobalExclusions();
        syncProjects();
    }

    private void syncGlobalExclusions() {
        List<EnvSyncProperties.ExclusionConfig> configured = properties.getExclusions();
        if (configured.isEmpty() && exclusionRepository.findByGlobalTrue().isEmpty()) {
            for (ExclusionRules.Rule rule : ExclusionRules.DEFAULT_GLOBAL) {
                exclusionRepository.save(ExclusionPattern.global(rule.pattern(), rule.reason()));
            }
            log.info("Seeded {} default global exclusion patterns", ExclusionRules.DEFAULT_GLOBAL.size());
            return;
        }
        int added = 0;
        for (EnvSyncProperties.ExclusionConfig cfg : configured) {
            if (!exclusionRepository.existsByGlobalTrueAndPattern(cfg.getPattern())) {
                exclusionRepository.save(ExclusionPattern.global(cfg.getPattern(), cfg.getReason()));
                added++;
            }
        }
        log.info("Synced global exclusions from config ({} added)", added);
    }

    private void syncProjects() {
        int synced = 0;
        for (EnvSyncProperties.ProjectConfig projectCfg : properties.getProjects()) {
            ProjectRepo project = projectRepository.findByProjectId(projectCfg.getId())
                    .orElseGet(() -> {
                        log.info("Adding new project: {} ({})", projectCfg.getId(), projectCfg.fullName());
                        return new ProjectRepo(projectCfg.getId(), projectCfg.getOwner(), projectCfg.getRepo());
                    });
            project.setOwner(projectCfg.getOwner());
            project.setName(projectCfg.getRepo());
            project.setValuesFile(projectCfg.getValuesFile());
            projectRepository.save(project);

            for (EnvSyncProperties.ExclusionConfig cfg : projectCfg.getExclusions()) {
                if (!exclusionRepository.existsByProjectIdAndPattern(projectCfg.getId(), cfg.getPattern())) {
                    exclusionRepository.save(ExclusionPattern.forProject(projectCfg.getId(), cfg.getPattern(), cfg.getReason()));
                }
            }
            synced++;
        }
        log.info("Synced {} projects from config", synced);
    }
}
