package com.libragraph.depot.core.container;

import com.libragraph.depot.core.model.FileVersion;
import com.libragraph.depot.core.query.FieldRef;
import com.libragraph.depot.core.query.Filter;
import com.libragraph.depot.core.query.Operator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CurrentVersionSelectorTest {

    private DepotFixture depot;

    @BeforeEach
    void setUp() {
        depot = new DepotFixture();
    }

    @Test
    void oneRecordPerFilenameNewestFirst() {
        depot.upload("docs", "a.txt", "a1");
        depot.upload("docs", "b.txt", "b1");
        FileVersion a2 = depot.upload("docs", "a.txt", "a2");
        FileVersion c1 = depot.upload("docs", "c.txt", "c1");
        FileVersion b2 = depot.upload("docs", "b.txt", "b2");

        List<FileVersion> current = depot.selector.select("docs", Filter.all()).await().indefinitely();

        assertThat(current).containsExactly(b2, c1, a2);
    }

    @Test
    void otherContainersAreIgnored() {
        FileVersion mine = depot.upload("docs", "a.txt", "1");
        depot.upload("other", "a.txt", "2");

        assertThat(depot.selector.select("docs", Filter.all()).await().indefinitely()).containsExactly(mine);
    }

    @Test
    void filterAppliesBeforeGrouping() {
        FileVersion approved = depot.upload("docs", "a.txt", "1", Map.of("approved", true));
        depot.upload("docs", "a.txt", "2", Map.of("approved", false));

        Filter onlyApproved = Filter.compare(FieldRef.metadata("approved"), Operator.EQ, true);

        assertThat(depot.selector.select("docs", onlyApproved).await().indefinitely()).containsExactly(approved);
        assertThat(depot.selector.count("docs", onlyApproved).await().indefinitely().count()).isEqualTo(1);
    }

    @Test
    void emptyContainerSelectsNothing() {
        assertThat(depot.selector.select("none", Filter.all()).await().indefinitely()).isEmpty();
    }
}
