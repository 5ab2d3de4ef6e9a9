package com.drinkjoy.catalog.infrastructure.persistence;

import com.drinkjoy.catalog.domain.model.Coordinates;
import com.drinkjoy.catalog.domain.model.Venue;
import com.drinkjoy.catalog.domain.port.out.VenueRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class JdbcVenueRepository implements VenueRepository {

    private static final Logger logger = LoggerFactory.getLogger(JdbcVenueRepository.class);

    private final JdbcTemplate jdbcTemplate;

    public JdbcVenueRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Venue> findById(String venueId) {
        String sql = """
            SELECT id, name, latitude, longitude, menu_sheet_id, active
            FROM venues
            WHERE id = ?
            """;
        try {
            return jdbcTemplate.query(sql, (rs, rowNum) -> new Venue(
                            rs.getString("id"),
                            rs.getString("name"),
                            new Coordinates(rs.getDouble("latitude"), rs.getDouble("longitude")),
                            rs.getString("menu_sheet_id"),
                            rs.getBoolean("active")
                    ), venueId)
                    .stream()
                    .findFirst();
        } catch (DataAccessException e) {
            logger.error("Database error while finding venue {}", venueId, e);
            return Optional.empty();
        }
    }
}
