package com.dailycode.domain.delivery.service;

import com.dailycode.domain.delivery.model.ProblemPayload;
import com.dailycode.domain.delivery.model.Solution;
import com.dailycode.domain.subscriber.model.Language;

public interface SolutionGenerator {

    /**
     * @throws com.dailycode.domain.delivery.exception.GenerationException if no solution could be produced
     */
    Solution generate(ProblemPayload problem, Language language);

    /**
     * Cheap reachability check used by the health check. Must not generate content.
     */
    boolean isReachable();
}
