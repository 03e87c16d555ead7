package com.argus.validation.jdbc;

import com.argus.validation.api.DataStoreException;
import com.argus.validation.core.config.ValidationConfig;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionGroupsTest {

    private static JdbcDataSource dataSource(String name) {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:" + name);
        return ds;
    }

    @Test
    @DisplayName("Null group resolves to the default group")
    void nullResolvesToDefault() {
        JdbcDataSource primary = dataSource("primary");
        ConnectionGroups groups = ConnectionGroups.of(primary);

        assertThat(groups.resolve(null)).isSameAs(primary);
        assertThat(groups.resolve("default")).isSameAs(primary);
        assertThat(groups.defaultGroup()).isEqualTo(ValidationConfig.DEFAULT_GROUP_NAME);
    }

    @Test
    @DisplayName("Named groups resolve independently")
    void namedGroups() {
        JdbcDataSource accounts = dataSource("accounts");
        JdbcDataSource reporting = dataSource("reporting");
        ConnectionGroups groups = new ConnectionGroups("accounts")
                .register("accounts", accounts)
                .register("reporting", reporting);

        assertThat(groups.resolve(null)).isSameAs(accounts);
        assertThat(groups.resolve("reporting")).isSameAs(reporting);
        assertThat(groups.names()).containsExactlyInAnyOrder("accounts", "reporting");
        assertThat(groups.contains("reporting")).isTrue();
        assertThat(groups.contains(null)).isFalse();
    }

    @Test
    @DisplayName("Default group name follows configuration")
    void fromConfig() {
        ValidationConfig config = ValidationConfig.forDevelopment().toBuilder()
                .defaultConnectionGroup("accounts")
                .build();

        assertThat(ConnectionGroups.fromConfig(config).defaultGroup()).isEqualTo("accounts");
    }

    @Test
    @DisplayName("Unknown group is a data-store error")
    void unknownGroup() {
        ConnectionGroups groups = ConnectionGroups.of(dataSource("only"));

        assertThatThrownBy(() -> groups.resolve("archive"))
                .isInstanceOf(DataStoreException.class)
                .hasMessageContaining("archive");
    }

    @Test
    @DisplayName("Re-registering a group replaces its data source")
    void replaceGroup() {
        JdbcDataSource first = dataSource("first");
        JdbcDataSource second = dataSource("second");
        ConnectionGroups groups = ConnectionGroups.of(first).register("default", second);

        assertThat(groups.resolve(null)).isSameAs(second);
    }

    @Test
    @DisplayName("Blank default group is rejected")
    void blankDefault() {
        assertThatThrownBy(() -> new ConnectionGroups(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
