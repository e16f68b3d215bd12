package com.dailycode.domain.delivery.service;

import com.dailycode.domain.delivery.model.Commentary;
import com.dailycode.domain.delivery.model.ProblemPayload;
import com.dailycode.domain.delivery.model.Solution;

public interface CommentaryGenerator {

    Commentary embellish(ProblemPayload problem, Solution solution);
}
