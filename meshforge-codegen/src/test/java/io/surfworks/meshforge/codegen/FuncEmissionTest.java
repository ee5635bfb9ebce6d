package io.surfworks.meshforge.codegen;

import io.surfworks.meshforge.codegen.config.EmitterConfig;
import io.surfworks.meshforge.codegen.rule.CommonEmitRule;
import io.surfworks.meshforge.codegen.rule.EmitRuleRegistry;
import io.surfworks.meshforge.ir.adapter.AdapterPrim;
import io.surfworks.meshforge.ir.adapter.CommPrim;
import io.surfworks.meshforge.ir.adapter.SpatialPrim;
import io.surfworks.meshforge.ir.cell.IRAdapter;
import io.surfworks.meshforge.ir.cell.IRBpOperation;
import io.surfworks.meshforge.ir.cell.IRDataOperation;
import io.surfworks.meshforge.ir.cell.IRFwOperation;
import io.surfworks.meshforge.ir.cell.IRWeightReducer;
import io.surfworks.meshforge.ir.value.ElementType;
import io.surfworks.meshforge.ir.value.IRObject;
import io.surfworks.meshforge.ir.value.IRTensor;
import io.surfworks.meshforge.ir.value.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FuncEmission")
class FuncEmissionTest {

    private static final String TIMER = EmitterConfig.DEFAULT_TIMER_FUNCTION;

    private EmitRuleRegistry rules;
    private FuncEmission emission;

    @BeforeEach
    void setUp() {
        rules = new EmitRuleRegistry()
            .registerAll(List.of("torch.add", "torch.nn.functional.linear", "print", "torch.split"),
                CommonEmitRule.INSTANCE);
        emission = new FuncEmission(rules);
    }

    private FuncEmission timed() {
        return new FuncEmission(rules, EmitterConfig.defaults().withLineTimer(true));
    }

    private static IRTensor t(String name, long tid) {
        return IRTensor.of(name, tid);
    }

    // ==================== Forward operations ====================

    @Nested
    @DisplayName("Forward operations")
    class Forward {

        @Test
        void simpleCallBindsItsOutputs() {
            IRFwOperation node = new IRFwOperation(4, "add", "torch.add",
                List.of(t("a", 1), t("b", 2)), List.of(t("c", 3)), Map.of("alpha", Value.of(1)));

            assertEquals(List.of("c_3 = torch.add(a_1, b_2, alpha=1)"),
                emission.emitFnode(node, 0, 1, 1, null));
        }

        @Test
        void commentPrecedesTheCall() {
            IRFwOperation node = new IRFwOperation(4, "add", "torch.add",
                List.of(t("a", 1), t("b", 2)), List.of(t("c", 3)));
            node.setComment("residual");

            assertEquals(List.of("# residual", "c_3 = torch.add(a_1, b_2)"),
                emission.emitFnode(node, 0, 1, 1, null));
        }

        @Test
        void attributeInputsTakeThePrefix() {
            IRTensor weight = new IRTensor("fc.weight", 3, List.of(4, 4), ElementType.F32, true);
            IRFwOperation node = new IRFwOperation(5, "linear", "torch.nn.functional.linear",
                List.of(t("x", 1), weight), List.of(t("y", 2)), Map.of("bias", Value.none()));

            assertEquals(List.of("y_2 = torch.nn.functional.linear(x_1, self.fc_weight_3, bias=None)"),
                emission.emitFnode(node, 0, 1, 1, "self."));
        }

        @Test
        void noOutputsEmitsTheBareCall() {
            IRFwOperation node = new IRFwOperation(6, "print", "print", List.of(t("x", 1)), List.of());

            assertEquals(List.of("print(x_1)"), emission.emitFnode(node, 0, 1, 1, null));
        }

        @Test
        void multipleManagedOutputsAreUnpacked() {
            IRFwOperation node = new IRFwOperation(8, "split", "torch.split",
                List.of(t("x", 1)), List.of(t("p", 2), t("q", 3)), Map.of("split_size_or_sections", Value.of(2)));

            assertEquals(List.of("p_2, q_3 = torch.split(x_1, split_size_or_sections=2)"),
                emission.emitFnode(node, 0, 1, 1, null));
        }

        @Test
        @DisplayName("nested outputs go through an intermediate that is released")
        void nestedOutputs() {
            rules.register("f", CommonEmitRule.INSTANCE);
            IRTensor x = t("x", 5);
            IRFwOperation node = new IRFwOperation(7, "f", "f",
                List.of(t("a", 1)), List.of(Value.tuple(Value.tuple(x))));

            assertEquals(List.of(
                "im_output_c7_s0 = f(a_1)",
                "x_5 = im_output_c7_s0[0][0]",
                "del im_output_c7_s0"), emission.emitFnode(node, 0, 1, 1, null));
        }

        @Test
        @DisplayName("managed and nested outputs mix in one binding")
        void mixedOutputs() {
            rules.register("g", CommonEmitRule.INSTANCE);
            Map<Value, Value> keyed = new LinkedHashMap<>();
            keyed.put(Value.of("k"), t("w", 8));
            IRFwOperation node = new IRFwOperation(9, "g", "g",
                List.of(t("a", 1)),
                List.of(t("y", 6), Value.list(t("z", 7)), Value.dict(keyed)));

            assertEquals(List.of(
                "y_6, im_output_c9_s1, im_output_c9_s2 = g(a_1)",
                "z_7 = im_output_c9_s1[0]",
                "w_8 = im_output_c9_s2['k']",
                "del im_output_c9_s1",
                "del im_output_c9_s2"), emission.emitFnode(node, 0, 1, 1, null));
        }

        @Test
        @DisplayName("intermediates never shadow a managed value with a look-alike name")
        void intermediateDoesNotCollideWithManagedNames() {
            rules.register("f", CommonEmitRule.INSTANCE);
            IRTensor lookalike = t("im_output.7", 0);
            IRFwOperation node = new IRFwOperation(7, "f", "f",
                List.of(lookalike), List.of(Value.list(t("x", 5))));

            List<String> codes = emission.emitFnode(node, 0, 1, 1, null);

            assertEquals(List.of(
                "im_output_c7_s0 = f(im_output_7_0)",
                "x_5 = im_output_c7_s0[0]",
                "del im_output_c7_s0"), codes);
            assertFalse(codes.contains("del " + emission.tensorName(lookalike)));
        }

        @Test
        void literalOutputSlotsAreBoundToIntermediates() {
            rules.register("h", CommonEmitRule.INSTANCE);
            IRFwOperation node = new IRFwOperation(3, "h", "h",
                List.of(t("a", 1)), List.of(t("b", 2), Value.of(0)));

            assertEquals(List.of(
                "b_2, im_output_c3_s1 = h(a_1)",
                "del im_output_c3_s1"), emission.emitFnode(node, 0, 1, 1, null));
        }

        @Test
        void intermediatePrefixIsConfigurable() {
            rules.register("f", CommonEmitRule.INSTANCE);
            FuncEmission custom = new FuncEmission(rules, EmitterConfig.defaults().withIntermediatePrefix("tmp"));
            IRFwOperation node = new IRFwOperation(7, "f", "f",
                List.of(t("a", 1)), List.of(Value.list(t("x", 5))));

            assertEquals(List.of("tmp_c7_s0 = f(a_1)", "x_5 = tmp_c7_s0[0]", "del tmp_c7_s0"),
                custom.emitFnode(node, 0, 1, 1, null));
        }

        @Test
        void rulesSeeTheRuntimeScale() {
            rules.register("scaled", (node, inputs, kwargs, devId, planN, runtimeN) ->
                "scaled(" + inputs.get(0) + ", rank=" + devId + ", group=" + (runtimeN / planN) + ")");
            IRFwOperation node = new IRFwOperation(2, "scaled", "scaled", List.of(t("x", 1)), List.of(t("y", 2)));

            assertEquals(List.of("y_2 = scaled(x_1, rank=5, group=2)"), emission.emitFnode(node, 5, 4, 8, null));
        }

        @Test
        void rulesReceiveKwargsAsLiteralText() {
            rules.register("reduce", (node, inputs, kwargs, devId, planN, runtimeN) ->
                "reduce(" + inputs.get(0) + ", op=" + kwargs.get("op") + ")");
            IRFwOperation node = new IRFwOperation(2, "reduce", "reduce",
                List.of(t("x", 1)), List.of(t("y", 2)), Map.of("op", Value.of("sum")));

            assertEquals(List.of("y_2 = reduce(x_1, op='sum')"), emission.emitFnode(node, 0, 1, 1, null));
        }

        @Test
        void missingRuleIsFatal() {
            IRFwOperation node = new IRFwOperation(2, "mystery", "custom.mystery", List.of(t("x", 1)), List.of());
            node.setComment("should not be emitted");

            EmissionException e = assertThrows(EmissionException.class,
                () -> emission.emitFnode(node, 0, 1, 1, null));
            assertEquals(EmissionException.ErrorCode.MISSING_RULE, e.errorCode());
            assertTrue(e.getMessage().contains("custom.mystery"));
        }

        @Test
        void timerProbeUsesTheComment() {
            IRFwOperation node = new IRFwOperation(4, "add", "torch.add",
                List.of(t("a", 1), t("b", 2)), List.of(t("c", 3)));
            node.setComment("layer0.add");

            assertEquals(List.of(
                "# layer0.add",
                TIMER + "('layer0.add')",
                "c_3 = torch.add(a_1, b_2)"), timed().emitFnode(node, 0, 1, 1, null));
        }

        @Test
        void emptyCommentLabelsTheTimerWithTheSignature() {
            IRFwOperation node = new IRFwOperation(4, "add", "torch.add",
                List.of(t("a", 1), t("b", 2)), List.of(t("c", 3)));
            node.setComment("");

            assertEquals(List.of("# ", TIMER + "('torch.add')", "c_3 = torch.add(a_1, b_2)"),
                timed().emitFnode(node, 0, 1, 1, null));
        }

        @Test
        void timerProbeFallsBackToTheSignature() {
            IRFwOperation node = new IRFwOperation(4, "add", "torch.add",
                List.of(t("a", 1), t("b", 2)), List.of(t("c", 3)));

            assertEquals(List.of(TIMER + "('torch.add')", "c_3 = torch.add(a_1, b_2)"),
                timed().emitFnode(node, 0, 1, 1, null));
        }
    }

    // ==================== Adapters ====================

    @Nested
    @DisplayName("Adapters")
    class Adapters {

        private final IRTensor t1 = t("t", 1);
        private final IRTensor t2 = t("t", 2);
        private final IRTensor t3 = t("t", 3);

        private SpatialPrim select() {
            return new SpatialPrim(SpatialPrim.Kind.SELECT, List.of(t1), List.of(t2),
                Map.of("indmap", Value.tuple(Value.slice(Value.of(0), Value.of(2), null))), List.of(0));
        }

        private CommPrim allReduce() {
            return new CommPrim(CommPrim.Kind.ALL_REDUCE, List.of(t2), List.of(t3),
                Map.of("ranks", Value.list(Value.of(0), Value.of(1))), List.of(0, 1));
        }

        private IRAdapter adapter(List<? extends AdapterPrim> prims) {
            IRAdapter adapter = new IRAdapter(20, List.of(t1), List.of(t3), prims, true);
            adapter.setDevice(List.of(0));
            return adapter;
        }

        @Test
        void primitivesAreEmittedInOrder() {
            assertEquals(List.of(
                "t_2 = nnscaler.runtime.adapter.select(t_1, indmap=(slice(0, 2, None),))",
                "t_3 = nnscaler.runtime.adapter.all_reduce(t_2, ranks=[0, 1])"),
                emission.emitAdapter(adapter(List.of(select(), allReduce()))));
        }

        @Test
        void legalAsyncMarksCollectives() {
            assertEquals(List.of(
                "t_2 = nnscaler.runtime.adapter.select(t_1, indmap=(slice(0, 2, None),))",
                "t_3 = nnscaler.runtime.adapter.all_reduce(t_2, ranks=[0, 1], async_op=True)"),
                emission.emitAdapter(adapter(List.of(select(), allReduce())), null, true));
        }

        @Test
        void illegalAsyncFallsBackToSynchronous() {
            SpatialPrim after = new SpatialPrim(SpatialPrim.Kind.IDENTITY, List.of(t3), List.of(t("t", 4)),
                Map.of(), List.of(0));

            List<String> codes = emission.emitAdapter(adapter(List.of(allReduce(), after)), null, true);

            assertEquals("t_3 = nnscaler.runtime.adapter.all_reduce(t_2, ranks=[0, 1])", codes.get(0));
            assertFalse(codes.get(0).contains("async_op"));
        }

        @Test
        void multipleInputsArePassedAsATuple() {
            SpatialPrim merge = new SpatialPrim(SpatialPrim.Kind.MERGE, List.of(t("a", 1), t("b", 2)),
                List.of(t("c", 3)), Map.of(), List.of(0));

            assertEquals(List.of("c_3 = nnscaler.runtime.adapter.merge((a_1, b_2, ), )"),
                emission.emitAdapter(adapter(List.of(merge))));
        }

        @Test
        void stringKwargsAreSplicedAsRuntimeNames() {
            SpatialPrim move = new SpatialPrim(SpatialPrim.Kind.MOVE, List.of(t1), List.of(t2),
                Map.of("dtype", Value.of("torch.float16")), List.of(0));

            assertEquals(List.of("t_2 = nnscaler.runtime.adapter.move(t_1, dtype=torch.float16)"),
                emission.emitAdapter(adapter(List.of(move))));
        }

        @Test
        void customDifferentiableAdapterIsOneCall() {
            IRAdapter custom = IRAdapter.custom(21, "nnscaler.runtime.adapter.nn.allreduce_identity",
                List.of(t("x", 1)), List.of(t("y", 2)),
                Map.of("ranks", Value.list(Value.of(0), Value.of(1))), true);
            custom.setDevice(List.of(1));

            assertEquals(List.of("y_2 = nnscaler.runtime.adapter.nn.allreduce_identity(x_1, ranks=[0, 1])"),
                emission.emitAdapter(custom, null, true));
        }

        @Test
        void timerProbePrecedesEachPrimitive() {
            assertEquals(List.of(
                TIMER + "('nnscaler.runtime.adapter.select')",
                "t_2 = nnscaler.runtime.adapter.select(t_1, indmap=(slice(0, 2, None),))",
                TIMER + "('nnscaler.runtime.adapter.all_reduce')",
                "t_3 = nnscaler.runtime.adapter.all_reduce(t_2, ranks=[0, 1])"),
                timed().emitAdapter(adapter(List.of(select(), allReduce()))));
        }

        @Test
        void adapterMustBeOnExactlyOneDevice() {
            IRAdapter spread = new IRAdapter(22, List.of(t1), List.of(t3), List.of(allReduce()), true);
            spread.setDevice(List.of(0, 1));
            IRAdapter unplaced = new IRAdapter(23, List.of(t1), List.of(t3), List.of(allReduce()), true);

            EmissionException e = assertThrows(EmissionException.class, () -> emission.emitAdapter(spread));
            assertEquals(EmissionException.ErrorCode.PLACEMENT_PRECONDITION, e.errorCode());
            assertThrows(EmissionException.class, () -> emission.emitAdapter(unplaced));
        }
    }

    // ==================== Other node kinds ====================

    @Nested
    @DisplayName("Data loading, reducers and releases")
    class OtherNodes {

        @Test
        void dataloaderAdvancesTheIterator() {
            IRDataOperation node = new IRDataOperation(1, new IRObject("dataloader", 0),
                List.of(t("data", 5), t("label", 6)));

            assertEquals(List.of("data_5, label_6 = next(dataloader_0)"), emission.emitDataloader(node));
        }

        @Test
        void dataloaderWithoutOutputsDiscards() {
            IRDataOperation node = new IRDataOperation(1, new IRObject("dataloader", 0), List.of());

            assertEquals(List.of("_ = next(dataloader_0)"), emission.emitDataloader(node));
        }

        @Test
        void reducerSyncsGradients() {
            IRWeightReducer reducer = new IRWeightReducer(30, 3, List.of(t("w", 1)));

            assertEquals(List.of("self.wreducer3.sync_grads()"), emission.emitReducer(reducer));
            assertEquals(List.of(TIMER + "('self.wreducer3')", "self.wreducer3.sync_grads()"),
                timed().emitReducer(reducer));
        }

        @Test
        void releaseDeletesNames() {
            assertEquals("del a_1, b_2", emission.emitRelease(List.of(t("a", 1), t("b", 2))));
            assertEquals("del c_3", emission.emitRelease(Set.of(t("c", 3))));
        }

        @Test
        void emptyReleaseIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> emission.emitRelease(List.of()));
        }
    }

    // ==================== Dispatch ====================

    @Nested
    @DisplayName("Dispatch")
    class Dispatch {

        @Test
        void forwardNodesUseTheContext() {
            IRTensor weight = new IRTensor("w", 3, List.of(2), ElementType.F32, true);
            IRFwOperation node = new IRFwOperation(4, "add", "torch.add",
                List.of(t("a", 1), weight), List.of(t("c", 2)));

            assertEquals(List.of("c_2 = torch.add(a_1, self.w_3)"),
                emission.emit(node, EmitContext.of(0, 2).withPrefixAttr("self.")));
        }

        @Test
        void adaptersHonorAsyncComm() {
            CommPrim reduce = new CommPrim(CommPrim.Kind.ALL_REDUCE, List.of(t("x", 1)), List.of(t("y", 2)),
                Map.of(), List.of(0, 1));
            IRAdapter adapter = new IRAdapter(5, List.of(t("x", 1)), List.of(t("y", 2)), List.of(reduce), true);
            adapter.setDevice(List.of(0));

            assertEquals(List.of("y_2 = nnscaler.runtime.adapter.all_reduce(x_1, async_op=True)"),
                emission.emit(adapter, EmitContext.of(0, 2).withAsyncComm(true)));
        }

        @Test
        void dataAndReducerNodesDispatch() {
            IRDataOperation data = new IRDataOperation(1, new IRObject("loader", 0), List.of(t("x", 1)));
            IRWeightReducer reducer = new IRWeightReducer(2, 0, List.of(t("w", 3)));

            assertEquals(List.of("x_1 = next(loader_0)"), emission.emit(data, EmitContext.of(0, 1)));
            assertEquals(List.of("self.wreducer0.sync_grads()"), emission.emit(reducer, EmitContext.of(0, 1)));
        }

        @Test
        void backwardNodesAreNotEmittedDirectly() {
            IRFwOperation fw = new IRFwOperation(4, "add", "torch.add", List.of(t("a", 1)), List.of(t("c", 2)));
            IRBpOperation bw = new IRBpOperation(5, "add", fw, List.of(), List.of());

            assertThrows(IllegalArgumentException.class, () -> emission.emit(bw, EmitContext.of(0, 1)));
        }
    }
}
