package com.ourd.plugin;

import com.ourd.plugin.process.PluginProcessPool;
import com.ourd.router.ActionException;
import com.ourd.router.Handler;
import com.ourd.router.RequestContext;

/**
 * Handler for an action declared by a plugin: forwards the request to the plugin's pool.
 */
public final class PluginHandler implements Handler {

    private final PluginProcessPool pool;
    private final String action;
    private final PluginContextSerializer serializer;

    public PluginHandler(PluginProcessPool pool, String action, PluginContextSerializer serializer) {
        this.pool = pool;
        this.action = action;
        this.serializer = serializer;
    }

    @Override
    public Object handle(RequestContext context) {
        try {
            return serializer.toValue(pool.call(action, serializer.action(context)));
        } catch (PluginException e) {
            throw new ActionException(PluginErrors.toActionError(e), e);
        }
    }
}
