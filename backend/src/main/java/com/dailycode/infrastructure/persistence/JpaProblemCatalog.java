package com.dailycode.infrastructure.persistence;

import com.dailycode.domain.common.exception.CatalogUnavailableException;
import com.dailycode.domain.problem.model.Difficulty;
import com.dailycode.domain.problem.model.Problem;
import com.dailycode.domain.problem.repository.ProblemRepository;
import com.dailycode.domain.problem.service.ProblemCatalog;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class JpaProblemCatalog implements ProblemCatalog {

    private final ProblemRepository problemRepository;
    private final StoreTransactions transactions;

    public JpaProblemCatalog(ProblemRepository problemRepository, PlatformTransactionManager transactionManager) {
        this.problemRepository = problemRepository;
        this.transactions = new StoreTransactions(transactionManager, CatalogUnavailableException::new);
    }

    @Override
    public List<Problem> findAll() {
        return transactions.read("load problem catalog", problemRepository::findAllByOrderByIdAsc);
    }

    @Override
    public Optional<Problem> findById(String problemId) {
        return transactions.read("look up problem", () -> problemRepository.findById(problemId));
    }

    @Override
    public Map<Difficulty, Long> countByDifficulty() {
        return transactions.read("count problems", () -> {
            Map<Difficulty, Long> counts = new EnumMap<>(Difficulty.class);
            for (Difficulty difficulty : Difficulty.values()) {
                counts.put(difficulty, problemRepository.countByDifficulty(difficulty));
            }
            return counts;
        });
    }
}
