package com.dailycode.infrastructure.persistence;

import com.dailycode.domain.common.exception.CatalogUnavailableException;
import com.dailycode.domain.common.exception.DirectoryUnavailableException;
import com.dailycode.domain.common.exception.HistoryUnavailableException;
import com.dailycode.domain.subscriber.model.DifficultyPreference;
import com.dailycode.domain.subscriber.model.Language;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the store adapters against a connection pool that has been shut down.
 */
@DataJpaTest(properties = "spring.datasource.url=jdbc:h2:mem:store-outage;DB_CLOSE_DELAY=-1")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
@Import({JpaSubscriberDirectory.class, JpaProblemCatalog.class, JpaDeliveryHistory.class,
        StoreOutageTest.FixedClock.class})
class StoreOutageTest {

    private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private DataSource dataSource;

    @Autowired
    private JpaSubscriberDirectory directory;

    @Autowired
    private JpaProblemCatalog catalog;

    @Autowired
    private JpaDeliveryHistory history;

    @BeforeEach
    void shutDownPool() throws SQLException {
        dataSource.unwrap(HikariDataSource.class).close();
    }

    @Test
    @DisplayName("the directory reports itself unavailable when no transaction can be opened")
    void directory() {
        assertThatThrownBy(() -> directory.findActive())
                .isInstanceOf(DirectoryUnavailableException.class)
                .hasCauseInstanceOf(CannotCreateTransactionException.class);
        assertThatThrownBy(() -> directory.register("alice@example.com", Language.PYTHON, DifficultyPreference.EASY))
                .isInstanceOf(DirectoryUnavailableException.class);
    }

    @Test
    @DisplayName("the catalog reports itself unavailable when no transaction can be opened")
    void catalog() {
        assertThatThrownBy(() -> catalog.findAll())
                .isInstanceOf(CatalogUnavailableException.class)
                .hasCauseInstanceOf(CannotCreateTransactionException.class);
    }

    @Test
    @DisplayName("the history reports itself unavailable for reads and writes")
    void history() {
        assertThatThrownBy(() -> history.lastAttemptAt())
                .isInstanceOf(HistoryUnavailableException.class)
                .hasCauseInstanceOf(CannotCreateTransactionException.class);
        assertThatThrownBy(() -> history.recordSuccess("alice@example.com", "two-sum", Language.PYTHON, NOW))
                .isInstanceOf(HistoryUnavailableException.class);
    }
}
