package io.github.drompincen.collabsync.runtime.ot;

import io.github.drompincen.collabsync.protocol.api.Operation;
import io.github.drompincen.collabsync.protocol.api.OperationKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OperationTransformerTest {

    @Test
    void insertSplicesContent() {
        assertThat(OperationTransformer.apply("held", insert("a", "lo", 3))).isEqualTo("hellod");
    }

    @Test
    void deleteRemovesCharacters() {
        assertThat(OperationTransformer.apply("abcdef", delete("a", 1, 2))).isEqualTo("adef");
    }

    @Test
    void positionsAreClampedToText() {
        assertThat(OperationTransformer.apply("abc", insert("a", "!", 10))).isEqualTo("abc!");
        assertThat(OperationTransformer.apply("abc", delete("a", 2, 10))).isEqualTo("ab");
        assertThat(OperationTransformer.apply("abc", delete("a", 7, 1))).isEqualTo("abc");
    }

    @Test
    void retainAndFormatLeaveTextUnchanged() {
        Operation retain = new Operation("r", OperationKind.RETAIN, 1, "a", null, 0, null, 2, null);
        Operation format = new Operation("f", OperationKind.FORMAT, 0, "a", null, 0, null, 3, Map.of("bold", true));

        assertThat(OperationTransformer.apply("abc", retain)).isEqualTo("abc");
        assertThat(OperationTransformer.apply("abc", format)).isEqualTo("abc");
    }

    @Test
    void insertBeforeOrAtShiftsLocalInsertRight() {
        Operation local = insert("b", "Y", 4);

        assertThat(OperationTransformer.transform(insert("a", "XX", 2), local).position()).isEqualTo(6);
        assertThat(OperationTransformer.transform(insert("a", "XX", 4), local).position()).isEqualTo(6);
        assertThat(OperationTransformer.transform(insert("a", "XX", 5), local).position()).isEqualTo(4);
    }

    @Test
    void deleteBeforeShiftsLocalInsertLeftAndClamps() {
        assertThat(OperationTransformer.transform(delete("a", 1, 2), insert("b", "Y", 4)).position()).isEqualTo(2);
        assertThat(OperationTransformer.transform(delete("a", 4, 2), insert("b", "Y", 4)).position()).isEqualTo(4);
        assertThat(OperationTransformer.transform(delete("a", 1, 9), insert("b", "Y", 3)).position()).isZero();
    }

    @Test
    void otherPairingsPassThrough() {
        Operation localDelete = delete("b", 3, 1);

        assertThat(OperationTransformer.transform(insert("a", "X", 0), localDelete)).isSameAs(localDelete);
        assertThat(OperationTransformer.transform(delete("a", 0, 1), localDelete)).isSameAs(localDelete);
    }

    @Test
    void insertsAtDistinctPositionsConvergeInEitherOrder() {
        String doc = "abcdef";
        Operation a = insert("alice", "X", 1);
        Operation b = insert("bob", "Y", 3);

        String atAlice = OperationTransformer.apply(OperationTransformer.apply(doc, a), OperationTransformer.transform(a, b));
        String atBob = OperationTransformer.apply(OperationTransformer.apply(doc, b), OperationTransformer.transform(b, a));

        assertThat(atAlice).isEqualTo("aXbcYdef").isEqualTo(atBob);
    }

    @Test
    void deleteBeforeInsertConvergesInEitherOrder() {
        String doc = "abcdef";
        Operation a = delete("alice", 1, 2);
        Operation b = insert("bob", "Z", 4);

        String atAlice = OperationTransformer.apply(OperationTransformer.apply(doc, a), OperationTransformer.transform(a, b));
        String atBob = OperationTransformer.apply(OperationTransformer.apply(doc, b), OperationTransformer.transform(b, a));

        assertThat(atAlice).isEqualTo("adZef").isEqualTo(atBob);
    }

    @Test
    void composeMergesContiguousInsertsOfSameAuthor() {
        List<Operation> composed = OperationTransformer.compose(List.of(
                insert("a", "he", 0), insert("a", "llo", 2), insert("a", "!", 9)));

        assertThat(composed).hasSize(2);
        assertThat(composed.get(0).content()).isEqualTo("hello");
        assertThat(composed.get(0).position()).isZero();
        assertThat(composed.get(1).content()).isEqualTo("!");
    }

    @Test
    void composeKeepsOtherAuthorsAndKindsApart() {
        List<Operation> ops = List.of(insert("a", "x", 0), insert("b", "y", 1), delete("b", 0, 1));

        assertThat(OperationTransformer.compose(ops)).isEqualTo(ops);
        assertThat(OperationTransformer.compose(List.of())).isEmpty();
    }

    private static Operation insert(String author, String content, int position) {
        return new Operation(author + "-" + content + "-" + position, OperationKind.INSERT, position, author,
                null, 0, content, null, null);
    }

    private static Operation delete(String author, int position, int length) {
        return new Operation(author + "-del-" + position, OperationKind.DELETE, position, author,
                null, 0, null, length, null);
    }
}
