package com.dbbaskette.envsync.service.classify;

import com.dbbaskette.envsync.model.ExclusionPattern;
import com.dbbaskette.envsync.repository.ExclusionPatternRepository;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the exclusion rules that apply to a project: global, project and run-local patterns.
 */
@Service
public class ExclusionService {

    private final ExclusionPatternRepository repository;

    public ExclusionService(ExclusionPatternRepository repository) {
        this.repository = repository;
    }

    public ExclusionRules rulesFor(String projectId, List<String> runLocalPatterns) {
        List<ExclusionRules.Rule> rules = new ArrayList<>();
        List<ExclusionPattern> global = repository.findByGlobalTrue();
        if (global.isEmpty()) {
            rules.addAll(ExclusionRules.DEFAULT_GLOBAL);
        } else {
            global.forEach(p -> rules.add(new ExclusionRules.Rule(p.getPattern(), p.getReason())));
        }
        repository.findByProjectId(projectId)
                .forEach(p -> rules.add(new ExclusionRules.Rule(p.getPattern(), p.getReason())));
        if (runLocalPatterns != null) {
            runLocalPatterns.forEach(p -> rules.add(new ExclusionRules.Rule(p, "Excluded for this run")));
        }
        return ExclusionRules.of(rules);
    }
}
