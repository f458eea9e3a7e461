package com.dbbaskette.envsync.config;

import com.dbbaskette.envsync.model.ExclusionPattern;
import com.dbbaskette.envsync.model.ProjectRepo;
import com.dbbaskette.envsync.repository.ExclusionPatternRepository;
import com.dbbaskette.envsync.repository.ProjectRepoRepository;
import com.dbbaskette.envsync.service.classify.ExclusionRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ConfigInitializerTest {

    private EnvSyncProperties properties;
    private ProjectRepoRepository projectRepository;
    private ExclusionPatternRepository exclusionRepository;
    private ConfigInitializer initializer;

    @BeforeEach
    void setUp() {
        properties = new EnvSyncProperties();
        projectRepository = mock(ProjectRepoRepository.class);
        exclusionRepository = mock(ExclusionPatternRepository.class);
        initializer = new ConfigInitializer(properties, projectRepository, exclusionRepository);
    }

    @Test
    void seedsDefaultExclusionsOnEmptyStore() {
        initializer.run(null);

        verify(exclusionRepository, times(ExclusionRules.DEFAULT_GLOBAL.size())).save(any(ExclusionPattern.class));
    }

    @Test
    void addsOnlyUnknownConfiguredExclusions() {
        properties.setExclusions(List.of(
                new EnvSyncProperties.ExclusionConfig("^LOCAL_", "local only"),
                new EnvSyncProperties.ExclusionConfig("^DEBUG_", "debug")));
        when(exclusionRepository.existsByGlobalTrueAndPattern("^LOCAL_")).thenReturn(true);

        initializer.run(null);

        ArgumentCaptor<ExclusionPattern> captor = ArgumentCaptor.forClass(ExclusionPattern.class);
        verify(exclusionRepository).save(captor.capture());
        assertEquals("^DEBUG_", captor.getValue().getPattern());
        assertTrue(captor.getValue().isGlobal());
    }

    @Test
    void updatesExistingProjectInPlace() {
        EnvSyncProperties.ProjectConfig cfg = new EnvSyncProperties.ProjectConfig();
        cfg.setId("demo");
        cfg.setOwner("acme");
        cfg.setRepo("renamed-app");
        cfg.setValuesFile("/srv/demo/.env");
        cfg.setExclusions(List.of(new EnvSyncProperties.ExclusionConfig("^SEED_", "fixtures")));
        properties.setProjects(List.of(cfg));
        properties.setExclusions(List.of(new EnvSyncProperties.ExclusionConfig("^GITHUB_", "reserved")));
        when(exclusionRepository.existsByGlobalTrueAndPattern("^GITHUB_")).thenReturn(true);
        ProjectRepo existing = new ProjectRepo("demo", "acme", "demo-app");
        when(projectRepository.findByProjectId("demo")).thenReturn(Optional.of(existing));

        initializer.run(null);

        verify(projectRepository).save(existing);
        assertEquals("renamed-app", existing.getName());
        assertEquals("/srv/demo/.env", existing.getValuesFile());
        ArgumentCaptor<ExclusionPattern> captor = ArgumentCaptor.forClass(ExclusionPattern.class);
        verify(exclusionRepository).save(captor.capture());
        assertEquals("demo", captor.getValue().getProjectId());
        assertFalse(captor.getValue().isGlobal());
    }
}
