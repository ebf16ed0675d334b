package in.cryptai.infrastructure.candidate;

import in.cryptai.application.port.output.CandidateProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads the active symbol universe. The symbols table is maintained by the host
 * application; this engine never writes to it.
 */
public final class PostgresCandidateProvider implements CandidateProvider {
    private static final Logger log = LoggerFactory.getLogger(PostgresCandidateProvider.class);

    private final DataSource dataSource;

    public PostgresCandidateProvider(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Set<String> listActive() {
        String sql = """
            SELECT symbol FROM symbols
            WHERE is_active = TRUE
            ORDER BY symbol
            """;

        Set<String> active = new LinkedHashSet<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                active.add(rs.getString("symbol"));
            }
            return active;

        } catch (Exception e) {
            log.error("Error listing active symbols: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to list active symbols", e);
        }
    }
}
