package com.drinkjoy.catalog.infrastructure.persistence;

import com.drinkjoy.catalog.domain.model.Venue;
import org.flywaydb.core.Flyway;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcVenueRepositoryTest {

    private JdbcTemplate jdbcTemplate;
    private JdbcVenueRepository repository;

    @BeforeEach
    void setUp() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:venues_" + System.nanoTime()
                + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        dataSource.setPassword("");
        Flyway.configure().dataSource(dataSource).load().migrate();

        jdbcTemplate = new JdbcTemplate(dataSource);
        repository = new JdbcVenueRepository(jdbcTemplate);
    }

    @Test
    void shouldFindVenueById() {
        // Given
        jdbcTemplate.update("""
                INSERT INTO venues (id, name, latitude, longitude, menu_sheet_id, active)
                VALUES ('bar-1', 'The Tap Room', 40.4168, -3.7038, 'sheet-bar-1', TRUE)
                """);

        // When
        Optional<Venue> venue = repository.findById("bar-1");

        // Then
        assertThat(venue).hasValueSatisfying(v -> {
            assertThat(v.name()).isEqualTo("The Tap Room");
            assertThat(v.coordinates().latitude()).isEqualTo(40.4168);
            assertThat(v.sourceLocator()).isEqualTo("sheet-bar-1");
            assertThat(v.active()).isTrue();
        });
    }

    @Test
    void shouldReturnEmptyForUnknownVenue() {
        assertThat(repository.findById("nowhere")).isEmpty();
    }
}
