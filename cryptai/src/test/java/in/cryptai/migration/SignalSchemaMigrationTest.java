package in.cryptai.migration;

import in.cryptai.support.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;

import static org.junit.jupiter.api.Assertions.*;

class SignalSchemaMigrationTest {

    private DataSource dataSource;

    @BeforeEach
    void setUp() {
        dataSource = TestDatabase.create();
    }

    @AfterEach
    void tearDown() {
        TestDatabase.shutdown(dataSource);
    }

    @Test
    void migrate_isIdempotent() {
        assertDoesNotThrow(() -> new SignalSchemaMigration(dataSource).migrate());
        assertEquals(0, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM generation_slots"));
        assertEquals(0, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM trading_signals"));
    }

    @Test
    void slotTable_rejectsDuplicateAndOutOfRangeHours() {
        TestDatabase.execute(dataSource,
            "INSERT INTO generation_slots (slot_date, slot_hour, created_at) VALUES (DATE '2024-05-01', 5, CURRENT_TIMESTAMP)");

        assertThrows(IllegalStateException.class, () -> TestDatabase.execute(dataSource,
            "INSERT INTO generation_slots (slot_date, slot_hour, created_at) VALUES (DATE '2024-05-01', 5, CURRENT_TIMESTAMP)"));
        assertThrows(IllegalStateException.class, () -> TestDatabase.execute(dataSource,
            "INSERT INTO generation_slots (slot_date, slot_hour, created_at) VALUES (DATE '2024-05-01', 24, CURRENT_TIMESTAMP)"));
    }
}
