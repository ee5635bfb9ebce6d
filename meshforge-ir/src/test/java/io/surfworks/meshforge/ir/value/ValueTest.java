package io.surfworks.meshforge.ir.value;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValueTest {

    @Test
    void sequencesArePermittedThroughTheirOwnSealedInterface() {
        List<Class<?>> permitted = List.of(Value.class.getPermittedSubclasses());

        assertTrue(Value.class.isSealed());
        assertTrue(permitted.contains(Value.SequenceValue.class));
        assertEquals(List.of(Value.ListValue.class, Value.TupleValue.class),
            List.of(Value.SequenceValue.class.getPermittedSubclasses()));
    }

    @Test
    void listsAndTuplesShareTheSequenceView() {
        Value.SequenceValue list = assertInstanceOf(Value.SequenceValue.class, Value.list(Value.of(1), Value.of(2)));
        Value.SequenceValue tuple = assertInstanceOf(Value.SequenceValue.class, Value.tuple(Value.of(1)));

        assertEquals(2, list.size());
        assertEquals(List.of(Value.of(1)), tuple.elements());
    }
}
