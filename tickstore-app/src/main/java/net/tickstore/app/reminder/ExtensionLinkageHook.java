package net.tickstore.app.reminder;

import net.tickstore.adapter.jdbc.hook.JobAddHook;
import net.tickstore.adapter.jdbc.hook.OwnerLinkageHook;
import net.tickstore.adapter.jdbc.mapper.JobRow;
import net.tickstore.core.model.JobExtra;

import java.sql.Connection;
import java.util.EnumMap;
import java.util.Map;

/**
 * One {@link OwnerLinkageHook} per {@link ExtensionType}: each user holds at most one job of each
 * kind. Jobs whose extra names an unknown type are stored without linkage.
 */
public class ExtensionLinkageHook implements JobAddHook {
    private final Map<ExtensionType, OwnerLinkageHook> hooks = new EnumMap<>(ExtensionType.class);

    public ExtensionLinkageHook() {
        for (ExtensionType t : ExtensionType.values()) hooks.put(t, new OwnerLinkageHook(t.code()));
    }

    private OwnerLinkageHook hookFor(JobExtra extra) {
        return ExtensionType.fromCode(extra.extensionType()).map(hooks::get).orElse(null);
    }

    @Override
    public boolean beforeAdd(JobRow job, JobExtra extra, Connection connection) throws Exception {
        OwnerLinkageHook hook = hookFor(extra);
        return hook != null && hook.beforeAdd(job, extra, connection);
    }

    @Override
    public void afterAdd(JobRow job, JobExtra extra, Connection transaction) throws Exception {
        OwnerLinkageHook hook = hookFor(extra);
        if (hook != null) hook.afterAdd(job, extra, transaction);
    }
}
