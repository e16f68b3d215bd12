package com.dailycode.domain.problem.service;

import com.dailycode.domain.problem.model.Difficulty;
import com.dailycode.domain.problem.model.Problem;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup of catalog problems.
 * All methods throw {@code CatalogUnavailableException} when the backing store cannot be reached.
 */
public interface ProblemCatalog {

    /**
     * Every problem, ordered by identity.
     */
    List<Problem> findAll();

    Optional<Problem> findById(String problemId);

    Map<Difficulty, Long> countByDifficulty();
}
