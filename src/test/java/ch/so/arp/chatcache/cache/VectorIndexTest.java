package ch.so.arp.chatcache.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.Test;

class VectorIndexTest {

    private final VectorIndex index = new VectorIndex(3);

    @Test
    void assignsDenseHandlesInInsertionOrder() {
        assertThat(index.add(new float[] { 1f, 0f, 0f }, "a", "A")).isZero();
        assertThat(index.add(new float[] { 0f, 1f, 0f }, "b", "B")).isEqualTo(1);
        assertThat(index.add(new float[] { 0f, 0f, 1f }, "c", "C")).isEqualTo(2);

        assertThat(index.size()).isEqualTo(3);
        assertThat(index.get(1)).contains("B");
    }

    @Test
    void searchOnEmptyIndexReturnsNothing() {
        assertThat(index.search(new float[] { 1f, 0f, 0f }, 5)).isEmpty();
    }

    @Test
    void searchOrdersByDescendingInnerProductAndLimitsToK() {
        index.add(new float[] { 0.6f, 0.8f, 0f }, "a", "A");
        index.add(new float[] { 1f, 0f, 0f }, "b", "B");
        index.add(new float[] { 0f, 0f, 1f }, "c", "C");
        index.add(new float[] { 0.8f, 0.6f, 0f }, "d", "D");

        List<VectorIndex.Neighbor> neighbors = index.search(new float[] { 1f, 0f, 0f }, 3);

        assertThat(neighbors).extracting(VectorIndex.Neighbor::handle).containsExactly(1, 3, 0);
        assertThat(neighbors.get(0).similarity()).isEqualTo(1.0d);
        assertThat(neighbors.get(1).similarity()).isCloseTo(0.8d, within(1e-6));
    }

    @Test
    void equalSimilaritiesKeepHandleOrder() {
        index.add(new float[] { 0f, 1f, 0f }, "a", "A");
        index.add(new float[] { 0f, 1f, 0f }, "b", "B");

        assertThat(index.search(new float[] { 0f, 1f, 0f }, 2))
                .extracting(VectorIndex.Neighbor::handle)
                .containsExactly(0, 1);
    }

    @Test
    void storesACopyOfTheVector() {
        float[] vector = { 1f, 0f, 0f };
        index.add(vector, "a", "A");
        vector[0] = 0f;

        assertThat(index.search(new float[] { 1f, 0f, 0f }, 1).get(0).similarity()).isEqualTo(1.0d);
    }

    @Test
    void rejectsVectorsOfTheWrongDimension() {
        assertThatThrownBy(() -> index.add(new float[] { 1f, 0f }, "a", "A"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> index.search(new float[] { 1f, 0f, 0f, 0f }, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(index.size()).isZero();
    }

    @Test
    void setReplacesTheResponseOfOneEntry() {
        index.add(new float[] { 1f, 0f, 0f }, "a", "A");
        index.add(new float[] { 0f, 1f, 0f }, "a", "A");

        index.set(1, "B");

        assertThat(index.get(0)).contains("A");
        assertThat(index.get(1)).contains("B");
        assertThat(index.size()).isEqualTo(2);
    }

    @Test
    void unknownHandlesHaveNoResponseAndCannotBeSet() {
        index.add(new float[] { 1f, 0f, 0f }, "a", "A");

        assertThat(index.get(1)).isEmpty();
        assertThat(index.get(-1)).isEmpty();
        assertThatThrownBy(() -> index.set(1, "B")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void refreshReplacesResponsesOfAllEntriesFromTheSameQuestion() {
        index.add(new float[] { 1f, 0f, 0f }, "question", "old");
        index.add(new float[] { 0f, 1f, 0f }, "other", "unchanged");
        index.add(new float[] { 0f, 0f, 1f }, "question", "old");

        assertThat(index.refresh("question", "new")).isEqualTo(2);

        assertThat(index.get(0)).contains("new");
        assertThat(index.get(1)).contains("unchanged");
        assertThat(index.get(2)).contains("new");
        assertThat(index.refresh("unknown", "x")).isZero();
    }
}
