package io.sentinel.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sentinel.application.port.output.SecurityMarketLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Reads a security's broker market id from the JSON blob in securities.data
 * ({@code {"mrkt": {"mkt_id": 30}}}).
 */
public final class PostgresSecurityMarketLookup implements SecurityMarketLookup {
    private static final Logger log = LoggerFactory.getLogger(PostgresSecurityMarketLookup.class);

    private final DataSource dataSource;
    private final ObjectMapper mapper;

    public PostgresSecurityMarketLookup(DataSource dataSource) {
        this(dataSource, new ObjectMapper());
    }

    public PostgresSecurityMarketLookup(DataSource dataSource, ObjectMapper mapper) {
        this.dataSource = dataSource;
        this.mapper = mapper;
    }

    @Override
    public Optional<String> findMarketId(String symbol) {
        String sql = "SELECT data FROM securities WHERE symbol = ?";

        String data;
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, symbol);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                data = rs.getString("data");
            }

        } catch (SQLException e) {
            log.error("[JOB STORE] Failed to read market for {}: {}", symbol, e.getMessage());
            throw new JobStoreException("findMarketId", e);
        }

        if (data == null || data.isBlank()) {
            return Optional.empty();
        }

        try {
            JsonNode marketId = mapper.readTree(data).path("mrkt").path("mkt_id");
            if (marketId.isMissingNode() || marketId.isNull()) {
                return Optional.empty();
            }
            return Optional.of(marketId.asText());
        } catch (JsonProcessingException e) {
            log.warn("[JOB STORE] Unreadable data for {}: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }
}
