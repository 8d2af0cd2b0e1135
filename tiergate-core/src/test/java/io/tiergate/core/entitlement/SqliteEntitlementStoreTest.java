package io.tiergate.core.entitlement;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import org.junit.jupiter.api.Test;

class SqliteEntitlementStoreTest extends EntitlementStoreContract {

    @Override
    EntitlementStore openStore() throws IOException {
        return new SqliteEntitlementStore(tempDir.resolve("entitlements.db"), defaults);
    }

    @Test
    void shouldKeepPaymentLedgerInItsOwnTable() throws Exception {
        Path db = tempDir.resolve("ledger").resolve("entitlements.db");
        EntitlementStore store = new SqliteEntitlementStore(db, defaults);
        store.markPaymentProcessed("alice", "pay_1");
        store.markPaymentProcessed("alice", "pay_2");

        assertThat(Files.exists(db)).isTrue();
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + db.toAbsolutePath());
             Statement statement = connection.createStatement();
             ResultSet rows = statement.executeQuery("SELECT COUNT(*) FROM processed_payments WHERE user_id = 'alice'")) {
            assertThat(rows.next()).isTrue();
            assertThat(rows.getInt(1)).isEqualTo(2);
        }
        assertThat(store.get("alice").processedPaymentIds()).containsExactlyInAnyOrder("pay_1", "pay_2");
    }
}
