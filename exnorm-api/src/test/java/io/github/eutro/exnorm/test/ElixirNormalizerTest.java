package io.github.eutro.exnorm.test;

import io.github.eutro.exnorm.api.ElixirNormalizer;
import io.github.eutro.exnorm.api.UnitNormalization;
import io.github.eutro.exnorm.api.events.*;
import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.conf.NormalizerConfig;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.BlockingQueue;

import static org.junit.jupiter.api.Assertions.*;

public class ElixirNormalizerTest {
    private static Node blockAssignment() {
        return new Match(new PVar("a"), new Block(Arrays.asList(
                new Match(new PVar("b"), new Call("compute", Collections.emptyList())),
                new If(new Var("cond"), new Var("t"), new Var("b"))
        )));
    }

    private static Node repoCall() {
        return new RemoteCall(new ModuleRef("Repo"), "all", Collections.singletonList(new ModuleRef("User")));
    }

    @Test
    void eventOrder() {
        ElixirNormalizer normalizer = new ElixirNormalizer();
        List<String> events = new ArrayList<>();
        normalizer.listen(RunUnitNormalizationEvent.class, evt -> events.add("run"));
        EventDispatcher<UnitEvent> units = normalizer.lift();
        units.listen(ModifyConfigEvent.class, evt -> events.add("config"));
        units.listen(PassAppliedEvent.class, evt -> {
            if (evt.changed()) events.add(evt.pass.name());
        });
        units.listen(EmitTreeEvent.class, evt -> events.add("emit"));

        Node result = normalizer.submit(blockAssignment()).run();

        assertEquals(Arrays.asList("run", "config", "HoistBlockAssignment", "emit"), events);
        assertEquals(new Block(Arrays.asList(
                new Match(new PVar("b"), new Call("compute", Collections.emptyList())),
                new Match(new PVar("a"), new If(new Var("cond"), new Var("t"), new Var("b")))
        )), result);
    }

    @Test
    void everyPassIsReported() {
        ElixirNormalizer normalizer = new ElixirNormalizer();
        List<Integer> indices = new ArrayList<>();
        UnitNormalization unit = normalizer.submit(new Var("x"));
        unit.listen(PassAppliedEvent.class, evt -> indices.add(evt.index));
        unit.run();
        assertEquals(22, indices.size());
        assertEquals(0, (int) indices.get(0));
        assertEquals(21, (int) indices.get(21));
    }

    @Test
    void configuresProjectModule() {
        ElixirNormalizer normalizer = new ElixirNormalizer();
        Node expected = new RemoteCall(new ModuleRef("MyApp.Repo"), "all",
                Collections.singletonList(new ModuleRef("User")));
        assertEquals(expected, normalizer.submit(repoCall()).setProjectModule("MyApp").run());
        assertEquals(repoCall(), normalizer.submit(repoCall()).run());

        ElixirNormalizer configured = new ElixirNormalizer(NormalizerConfig.builder().setProjectModule("MyApp").build());
        assertEquals(expected, configured.submit(repoCall()).run());
        configured.lift().listen(ModifyConfigEvent.class, evt -> evt.configBuilder.setProjectModule(null));
        assertEquals(repoCall(), configured.submit(repoCall()).run());
    }

    @Test
    void outputsQueue() throws InterruptedException {
        ElixirNormalizer normalizer = new ElixirNormalizer();
        BlockingQueue<Node> outputs = normalizer.outputsAsQueue();
        Node result = normalizer.submit(blockAssignment()).run();
        assertSame(result, outputs.take());
        assertTrue(outputs.isEmpty());
    }

    @Test
    void cancelledEmitSkipsLaterListeners() {
        ElixirNormalizer normalizer = new ElixirNormalizer();
        normalizer.lift().listen(EmitTreeEvent.class, EmitTreeEvent::cancel);
        BlockingQueue<Node> outputs = normalizer.outputsAsQueue();
        Node result = normalizer.submit(new Var("x")).run();
        assertEquals(new Var("x"), result);
        assertTrue(outputs.isEmpty());
    }

    @Test
    void removedListenersStopReceiving() {
        ElixirNormalizer normalizer = new ElixirNormalizer();
        List<Node> emitted = new ArrayList<>();
        EventDispatcher.Registration registration = normalizer.lift().listen(EmitTreeEvent.class, evt -> emitted.add(evt.tree));
        normalizer.submit(new Var("x")).run();
        registration.remove();
        normalizer.submit(new Var("y")).run();
        assertEquals(Collections.singletonList(new Var("x")), emitted);

        UnitNormalization unit = normalizer.submit(new Var("z"));
        List<Integer> indices = new ArrayList<>();
        unit.listen(PassAppliedEvent.class, evt -> indices.add(evt.index)).remove();
        registration.remove();
        unit.run();
        assertTrue(indices.isEmpty());
    }

    @Test
    void normalizeAllKeepsOrder() {
        ElixirNormalizer normalizer = new ElixirNormalizer();
        List<Node> units = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            units.add(i % 2 == 0 ? blockAssignment() : new Def(Def.Kind.DEF, "f" + i,
                    Collections.singletonList(new PVar("value")), null, new IntLit(i)));
        }
        List<Node> sequential = normalizer.normalizeAll(units);
        List<Node> parallel = normalizer.normalizeAll(units, true);
        assertEquals(sequential, parallel);
        assertEquals(new Def(Def.Kind.DEF, "f1", Collections.singletonList(new PVar("_value")), null, new IntLit(1)),
                sequential.get(1));
    }
}
