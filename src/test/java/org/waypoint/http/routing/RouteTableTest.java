package org.waypoint.http.routing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RouteTableTest {

    private final Controller controller = new Controller() { };
    private final RouteAction<String, StringBuilder> first = (request, response) -> response.append("first");
    private final RouteAction<String, StringBuilder> second = (request, response) -> response.append("second");

    private RouteTable<String, StringBuilder> table;

    @BeforeEach
    void setUp() {
        table = new RouteTable<>();
    }

    @Test
    void table_starts_empty() {
        assertThat(table.isEmpty()).isTrue();
        assertThat(table.size()).isZero();
        assertThat(table.find("/anything")).isEmpty();
    }

    @Test
    void keeps_duplicates_in_registration_order() {
        table.add(new RouteEntry<>("/api/widgets/", controller, first));
        table.add(new RouteEntry<>("/api/widgets/", controller, second));

        assertThat(table.size()).isEqualTo(2);
        assertThat(table.get(0).action()).isSameAs(first);
        assertThat(table.get(1).action()).isSameAs(second);
    }

    @Test
    void find_returns_first_registered_match() {
        table.add(new RouteEntry<>("/api/widgets/", controller, first));
        table.add(new RouteEntry<>("/api/widgets/", controller, second));

        assertThat(table.find("/api/widgets").orElseThrow().action()).isSameAs(first);
    }

    @Test
    void find_ignores_leading_slash_trailing_slash_and_query() {
        table.add(new RouteEntry<>("widgets/", controller, first));

        assertThat(table.find("/widgets")).isPresent();
        assertThat(table.find("/widgets/")).isPresent();
        assertThat(table.find("widgets?page=2")).isPresent();
        assertThat(table.find("/widgets/extra")).isEmpty();
        assertThat(table.find(null)).isEmpty();
    }

    @Test
    void entries_view_is_read_only() {
        table.add(new RouteEntry<>("a/", controller, first));

        assertThatThrownBy(() -> table.entries().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThat(table).hasSize(1);
    }

    @Test
    void entry_rejects_missing_controller() {
        assertThatThrownBy(() -> new RouteEntry<>("a/", null, first)).isInstanceOf(NullPointerException.class);
    }

}
