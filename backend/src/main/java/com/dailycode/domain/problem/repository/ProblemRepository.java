package com.dailycode.domain.problem.repository;

import com.dailycode.domain.problem.model.Difficulty;
import com.dailycode.domain.problem.model.Problem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ProblemRepository extends JpaRepository<Problem, String> {

    List<Problem> findAllByOrderByIdAsc();

    long countByDifficulty(Difficulty difficulty);
}
