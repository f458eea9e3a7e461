package com.dbbaskette.envsync.service.classify;

import com.dbbaskette.envsync.model.ExclusionPattern;
import com.dbbaskette.envsync.repository.ExclusionPatternRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ExclusionServiceTest {

    private ExclusionPatternRepository repository;
    private ExclusionService service;

    @BeforeEach
    void setUp() {
        repository = mock(ExclusionPatternRepository.class);
        service = new ExclusionService(repository);
    }

    @Test
    void fallsBackToDefaultsWhenNoGlobalPatternsStored() {
        when(repository.findByGlobalTrue()).thenReturn(List.of());
        when(repository.findByProjectId("demo")).thenReturn(List.of());

        ExclusionRules rules = service.rulesFor("demo", null);

        assertEquals(ExclusionRules.DEFAULT_GLOBAL.size(), rules.size());
        assertTrue(rules.isExcluded("GITHUB_TOKEN"));
    }

    @Test
    void combinesGlobalProjectAndRunLocalPatterns() {
        when(repository.findByGlobalTrue()).thenReturn(List.of(ExclusionPattern.global("^INTERNAL_", "internal")));
        when(repository.findByProjectId("demo"))
                .thenReturn(List.of(ExclusionPattern.forProject("demo", "^LOCAL_", "local")));

        ExclusionRules rules = service.rulesFor("demo", List.of("^TMP_"));

        assertEquals(3, rules.size());
        assertTrue(rules.isExcluded("INTERNAL_KEY"));
        assertTrue(rules.isExcluded("LOCAL_PORT"));
        assertEquals("Excluded for this run", rules.match("TMP_FILE").orElseThrow().reason());
        // stored globals replace the built-in defaults
        assertFalse(rules.isExcluded("GITHUB_TOKEN"));
    }
}
