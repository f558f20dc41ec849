package de.t14d3.spindle.hooks;

import de.t14d3.spindle.exceptions.HookException;

/**
 * Dispatches lifecycle hooks to the records that implement them. Anything a hook
 * throws is wrapped in a {@link HookException} naming the hook.
 */
public final class Hooks {
    private Hooks() {
    }

    public static void beforeSave(Object record) {
        if (record instanceof BeforeSave hook) {
            run("beforeSave", hook::beforeSave);
        }
    }

    public static void beforeInsert(Object record) {
        if (record instanceof BeforeInsert hook) {
            run("beforeInsert", hook::beforeInsert);
        }
    }

    public static void beforeUpdate(Object record) {
        if (record instanceof BeforeUpdate hook) {
            run("beforeUpdate", hook::beforeUpdate);
        }
    }

    public static void beforeDelete(Object record) {
        if (record instanceof BeforeDelete hook) {
            run("beforeDelete", hook::beforeDelete);
        }
    }

    public static void afterInsert(Object record) {
        if (record instanceof AfterInsert hook) {
            run("afterInsert", hook::afterInsert);
        }
    }

    public static void afterUpdate(Object record) {
        if (record instanceof AfterUpdate hook) {
            run("afterUpdate", hook::afterUpdate);
        }
    }

    public static void afterSave(Object record) {
        if (record instanceof AfterSave hook) {
            run("afterSave", hook::afterSave);
        }
    }

    public static void afterDelete(Object record) {
        if (record instanceof AfterDelete hook) {
            run("afterDelete", hook::afterDelete);
        }
    }

    /**
     * Whether the record implements any After* hook. Such records are written inside
     * a transaction so a failing hook can undo the write.
     */
    public static boolean hasAfterHooks(Object record) {
        return record instanceof AfterInsert || record instanceof AfterUpdate
                || record instanceof AfterSave || record instanceof AfterDelete;
    }

    private static void run(String name, Runnable hook) {
        try {
            hook.run();
        } catch (HookException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new HookException(name, e);
        }
    }
}
