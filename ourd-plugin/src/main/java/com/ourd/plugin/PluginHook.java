package com.ourd.plugin;

import com.ourd.hook.Hook;
import com.ourd.hook.HookEvent;
import com.ourd.plugin.process.PluginProcessPool;
import com.ourd.router.ActionException;

import java.util.Map;

/**
 * Hook declared by a plugin. An object result replaces the record; anything else leaves it unchanged.
 */
public final class PluginHook implements Hook {

    private final PluginProcessPool pool;
    private final String name;
    private final PluginContextSerializer serializer;

    public PluginHook(PluginProcessPool pool, String name, PluginContextSerializer serializer) {
        this.pool = pool;
        this.name = name;
        this.serializer = serializer;
    }

    @Override
    public Map<String, Object> invoke(HookEvent event) {
        try {
            return serializer.toRecord(pool.call(name, serializer.hook(event)));
        } catch (PluginException e) {
            throw new ActionException(PluginErrors.toActionError(e), e);
        }
    }
}
