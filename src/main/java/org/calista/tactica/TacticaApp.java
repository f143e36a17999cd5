package org.calista.tactica;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.tactica.core.ProverKernel;
import org.calista.tactica.proof.CaseResult;
import org.calista.tactica.proof.ProofBranch;
import org.calista.tactica.proof.ProofState;
import org.calista.tactica.proof.Theorem;
import org.calista.tactica.proof.TheoremBuilder;
import org.calista.tactica.tactic.RewriteDirection;
import org.calista.tactica.term.MathExpression;
import org.calista.tactica.term.MathRelation;
import org.calista.tactica.term.TypeView;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * TacticaApp: console runner for the bundled derivations.
 *
 * Lifecycle:
 *  1) build kernel from config/tactica.json (created with defaults when missing)
 *  2) register the axioms the derivations rely on
 *  3) run commutativity of addition, then a parity case split
 *  4) print forests, export theorem + snapshot
 */
public final class TacticaApp {

    private static final Logger log = LogManager.getLogger(TacticaApp.class);

    private final Path cfgPath;

    public TacticaApp(Path cfgPath) {
        this.cfgPath = cfgPath;
    }

    public static void main(String[] args) throws Exception {
        Path cfg = args.length > 0 ? Path.of(args[0]) : Path.of("config/tactica.json");
        new TacticaApp(cfg).run();
    }

    public void run() throws IOException {
        try (ProverKernel kernel = ProverKernel.builder().configRoot(Path.of(".")).build(cfgPath)) {
            registerAxioms(kernel);

            Theorem comm = commutativity(kernel);
            System.out.println("Built " + comm.id() + ": " + comm.initialProofState().statement().render());

            Theorem parity = parity(kernel);
            System.out.println("Built " + parity.id() + ": " + parity.initialProofState().statement().render());
        }
    }

    private static void registerAxioms(ProverKernel kernel) {
        MathExpression a = MathExpression.var("a");
        MathExpression b = MathExpression.var("b");
        MathRelation axiom = MathRelation.equal(MathExpression.add(a, b), MathExpression.add(b, a));
        kernel.registry().register(Theorem.of("add comm", ProofState.initial(axiom, null)));
    }

    /** a + b = b + a, by rewriting with the commutativity axiom. */
    static Theorem commutativity(ProverKernel kernel) throws IOException {
        MathExpression a = MathExpression.var("a");
        MathExpression b = MathExpression.var("b");
        MathExpression ab = MathExpression.add(a, b);
        MathExpression ba = MathExpression.add(b, a);

        TheoremBuilder tb = kernel.newTheorem("Addition is commutative", MathRelation.equal(ab, ba), List.of());
        TypeView ring = TypeView.of(TypeView.Kind.AS_RING_ELEMENT, "Z");

        ProofBranch p = tb.initialBranch()
                .introduce("a", a, ring, 1)
                .introduce("b", b, ring, 2)
                .applyTheorem("thm_add_comm", Map.of("x", a, "y", b), 3)
                .bookmark("after-axiom");

        ProofBranch done = p.rewrite(ab, MathExpression.of(MathRelation.equal(ab, ba)), RewriteDirection.FORWARD, 4);
        log.info("Rewritten: {}", done.state().statement().render());
        done.markComplete();

        // an abandoned alternative from the same node
        p.branch().substitute(MathExpression.var("c"), a, 5).markAbandoned();

        System.out.println(done.summary());
        return kernel.finish(tb);
    }

    /** n * n has the parity of n, split into even and odd. */
    static Theorem parity(ProverKernel kernel) throws IOException {
        MathExpression n = MathExpression.var("n");
        MathExpression square = MathExpression.mul(n, n);
        MathRelation stmt = MathRelation.equal(
                MathExpression.op("parity", square), MathExpression.op("parity", n));

        TheoremBuilder tb = kernel.newTheorem("Square parity", stmt, List.of());
        ProofBranch start = tb.initialBranch().introduce("n", n, 1);

        CaseResult split = start.caseAnalysis()
                .onExpression(n)
                .caseOf("n is even", c -> c
                        .simplify(square, List.of("n = 2k"), 2)
                        .markComplete())
                .caseOf("n is odd", c -> c
                        .simplify(square, List.of("n = 2k + 1"), 2)
                        .markComplete())
                .build();
        split.shouldComplete();

        System.out.println(start.visualizeForest());
        return kernel.finish(tb);
    }
}
