package com.argus.validation.jdbc;

import com.argus.validation.api.DataStoreException;
import com.argus.validation.api.RuleName;
import com.argus.validation.api.model.Submission;
import com.argus.validation.core.config.ValidationConfig;
import com.argus.validation.core.params.PlaceholderResolver;
import com.argus.validation.core.rules.ValidationRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Rule set wired to a real JDBC store over H2.
 */
class UniquenessRulesIntegrationTest {

    private ValidationRules rules;

    @BeforeEach
    void setUp() throws SQLException {
        DataSource accounts = H2Fixture.database("rules_accounts",
                "INSERT INTO users VALUES (5, 'a@b.com', 'ada')");
        DataSource reporting = H2Fixture.database("rules_reporting",
                "INSERT INTO users VALUES (9, 'r@e.com', 'rep')");

        ValidationConfig config = ValidationConfig.forDevelopment();
        ConnectionGroups groups = ConnectionGroups.fromConfig(config)
                .register(config.defaultConnectionGroup(), accounts)
                .register("reporting", reporting);
        rules = new ValidationRules(new JdbcExistenceStore(groups, config), config);
    }

    @Test
    @DisplayName("Signup rejects a taken email")
    void signupRejectsTakenEmail() {
        assertThat(rules.isUnique("a@b.com", "users.email", Submission.empty())).isFalse();
        assertThat(rules.isUnique("fresh@b.com", "users.email", Submission.empty())).isTrue();
    }

    @Test
    @DisplayName("Profile update may keep its own email")
    void updateKeepsOwnEmail() {
        Submission form = Submission.of(Map.of("id", "5", "email", "a@b.com"));
        String spec = PlaceholderResolver.resolve("users.email,id,{id}", form);

        assertThat(rules.evaluate(RuleName.IS_UNIQUE, form.get("email"), spec, form)).isTrue();
    }

    @Test
    @DisplayName("Login lookup requires an existing row")
    void loginLookup() {
        assertThat(rules.isNotUnique("a@b.com", "users.email", Submission.empty())).isTrue();
        assertThat(rules.isNotUnique("a@b.com", "users.email,nickname,ada", Submission.empty())).isTrue();
        assertThat(rules.isNotUnique("a@b.com", "users.email,nickname,bob", Submission.empty())).isFalse();
    }

    @Test
    @DisplayName("DBGroup selects the reporting database")
    void groupSelection() {
        Submission reporting = Submission.of(Map.of("DBGroup", "reporting"));

        assertThat(rules.isUnique("r@e.com", "users.email", reporting)).isFalse();
        assertThat(rules.isUnique("r@e.com", "users.email", Submission.empty())).isTrue();
    }

    @Test
    @DisplayName("Missing table is an error, not a unique value")
    void missingTable() {
        assertThatThrownBy(() -> rules.isUnique("a@b.com", "accounts.email", Submission.empty()))
                .isInstanceOf(DataStoreException.class);
    }
}
