package io.github.monossa.passes.convert;

import io.github.monossa.ast.FunctionDef;
import io.github.monossa.ast.Program;
import io.github.monossa.conf.SsaGenOptions;
import io.github.monossa.ssa.Function;
import io.github.monossa.ssa.FunctionId;
import io.github.monossa.ssa.SsaProgram;
import io.github.monossa.util.Pair;
import io.github.monossa.util.Tree;
import org.apache.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * The state shared by every function of a single program conversion.
 * <p>
 * Source functions are only translated once something refers to them, starting from main.
 * The first reference reserves an id for the function and queues it; the queue is drained
 * in order until nothing new is referenced.
 */
public final class ProgramDriver {
    private static final Logger LOGGER = Logger.getLogger(ProgramDriver.class);

    public final Program program;
    final SsaGenOptions options;
    private final Map<Integer, FunctionId> functions = new HashMap<>();
    private final Deque<Pair<Integer, FunctionId>> functionQueue = new ArrayDeque<>();
    private int nextId = 0;

    public ProgramDriver(Program program, SsaGenOptions options) {
        this.program = program;
        this.options = options;
    }

    /**
     * Get the id reserved for a source function, reserving one and queueing the function
     * for translation if this is the first reference to it.
     *
     * @param sourceId The id of the function in the source program.
     * @return The id of the function in the output program.
     */
    public FunctionId getOrQueueFunction(int sourceId) {
        FunctionId existing = functions.get(sourceId);
        if (existing != null) {
            return existing;
        }
        FunctionId id = reserve(sourceId);
        functionQueue.addLast(Pair.of(sourceId, id));
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(String.format("Queued %s as %s", program.get(sourceId).name, id));
        }
        return id;
    }

    @Nullable
    public Pair<Integer, FunctionId> popNextFunctionInQueue() {
        return functionQueue.pollFirst();
    }

    private FunctionId reserve(int sourceId) {
        FunctionId id = new FunctionId(nextId++);
        functions.put(sourceId, id);
        return id;
    }

    /**
     * Translate main, then everything reachable from it.
     *
     * @return The output program.
     */
    public SsaProgram generate() {
        FunctionDef main = program.main();
        FunctionId mainId = reserve(main.id);
        SsaProgram ssa = new SsaProgram(mainId);
        ssa.add(generateFunction(mainId, main));

        Pair<Integer, FunctionId> next;
        while ((next = popNextFunctionInQueue()) != null) {
            ssa.add(generateFunction(next.right, program.get(next.left)));
        }
        LOGGER.info(String.format("Generated %d functions from %d in the program", ssa.size(), program.size()));
        return ssa;
    }

    private Function generateFunction(FunctionId id, FunctionDef def) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(String.format("Generating %s as %s", def.name, id));
        }
        FunctionContext ctx = new FunctionContext(this, id, def);
        Tree<Value> result = new ExpressionTranslator(ctx).translate(def.body);
        Function func = ctx.finish(result);
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace(func);
        }
        return func;
    }
}
