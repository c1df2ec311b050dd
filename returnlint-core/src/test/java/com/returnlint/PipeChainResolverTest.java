package com.returnlint;

import com.returnlint.ast.*;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.returnlint.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class PipeChainResolverTest {

    @Test
    void plainCallResolvesToItself() {
        Call call = call(loc(1, 1, 1, 9), "return", symbol(loc(1, 8, 1, 8), "x"));

        assertEquals(Optional.of(call), PipeChainResolver.resolveCallTarget(call));
        assertFalse(PipeChainResolver.isMagrittrChain(call));
    }

    @Test
    void leftNestedChainResolvesToLastStage() {
        // x %>% filter(y > 5) %>% summarize(z) %>% return()
        Call filter = call(loc(2, 5, 2, 19), "filter", expr(loc(2, 12, 2, 18), "y > 5"));
        Call summarize = call(loc(3, 5, 3, 16), "summarize", symbol(loc(3, 15, 3, 15), "z"));
        Call ret = call(loc(4, 5, 4, 12), "return");
        PipeStage chain = pipe(loc(1, 1, 4, 12),
            pipe(loc(1, 1, 3, 16), pipe(loc(1, 1, 2, 19), symbol(loc(1, 1, 1, 1), "x"), filter), summarize),
            ret);

        assertEquals(Optional.of(ret), PipeChainResolver.resolveCallTarget(chain));
        assertTrue(PipeChainResolver.isMagrittrChain(chain));
    }

    @Test
    void rightNestedChainResolvesToLastStage() {
        Call f = call(loc(1, 6, 1, 8), "f");
        Call g = call(loc(1, 14, 1, 16), "g");
        PipeStage chain = pipe(loc(1, 1, 1, 16), symbol(loc(1, 1, 1, 1), "x"), pipe(loc(1, 6, 1, 16), f, g));

        assertSame(g, PipeChainResolver.finalStage(chain));
        assertEquals(Optional.of(g), PipeChainResolver.resolveCallTarget(chain));
    }

    @Test
    void intermediateReturnIsNotTheTarget() {
        // x %>% return() %>% identity()
        Call ret = call(loc(1, 7, 1, 14), "return");
        Call identity = call(loc(1, 20, 1, 29), "identity");
        PipeStage chain = pipe(loc(1, 1, 1, 29), pipe(loc(1, 1, 1, 14), symbol(loc(1, 1, 1, 1), "x"), ret), identity);

        assertEquals(Optional.of(identity), PipeChainResolver.resolveCallTarget(chain));
    }

    @Test
    void nonCallFinalStageHasNoTarget() {
        PipeStage chain = pipe(loc(1, 1, 1, 10), symbol(loc(1, 1, 1, 1), "x"), expr(loc(1, 7, 1, 10), "{ . }"));

        assertEquals(Optional.empty(), PipeChainResolver.resolveCallTarget(chain));
        assertEquals(Optional.empty(), PipeChainResolver.resolveCallTarget(expr(loc(1, 1, 1, 5), "x + 1")));
    }

    @Test
    void missingFinalStageHasNoTarget() {
        PipeStage chain = new PipeStage(loc(1, 1, 1, 5), PipeStage.NATIVE, symbol(loc(1, 1, 1, 1), "x"), null);

        assertNull(PipeChainResolver.finalStage(chain));
        assertEquals(Optional.empty(), PipeChainResolver.resolveCallTarget(chain));
    }

    @Test
    void nativePipeResolvesButIsNotAMagrittrChain() {
        // x |> return()
        Call ret = call(loc(1, 6, 1, 13), "return");
        PipeStage chain = new PipeStage(loc(1, 1, 1, 13), PipeStage.NATIVE, symbol(loc(1, 1, 1, 1), "x"), ret);

        assertEquals(Optional.of(ret), PipeChainResolver.resolveCallTarget(chain));
        assertFalse(PipeChainResolver.isMagrittrChain(chain));
    }
}
