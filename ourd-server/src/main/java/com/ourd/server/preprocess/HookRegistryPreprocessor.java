package com.ourd.server.preprocess;

import com.ourd.hook.HookRegistry;
import com.ourd.router.Preprocessor;
import com.ourd.router.RequestContext;

public final class HookRegistryPreprocessor implements Preprocessor {

    private final HookRegistry registry;

    public HookRegistryPreprocessor(HookRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void process(RequestContext context) {
        context.setAttribute(HookRegistry.CONTEXT_ATTRIBUTE, registry);
    }
}
