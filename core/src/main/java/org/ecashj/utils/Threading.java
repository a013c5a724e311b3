/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.ecashj.utils;

import com.google.common.util.concurrent.CycleDetectingLockFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Various threading related utilities. Provides a wrapper around explicit lock creation that lets you control
 * whether cycle detection is enabled, and an executor that runs listener callbacks on the calling thread.
 */
public class Threading {
    private static final Logger log = LoggerFactory.getLogger(Threading.class);

    /**
     * An executor that runs tasks on the thread that submits them. Listeners registered with this executor
     * must not block or take locks held by the caller.
     */
    public static final Executor SAME_THREAD = Runnable::run;

    private static CycleDetectingLockFactory.Policy policy = CycleDetectingLockFactory.Policies.THROW;
    private static CycleDetectingLockFactory factory = CycleDetectingLockFactory.newInstance(policy);

    public static ReentrantLock lock(Class<?> clazz) {
        return lock(clazz.getSimpleName() + " lock");
    }

    public static ReentrantLock lock(String name) {
        return lock(name, false);
    }

    /**
     * Creates a lock with the given name. A fair lock grants access to the longest waiting thread, so
     * contenders are served in arrival order.
     */
    public static ReentrantLock lock(String name, boolean fair) {
        return factory.newReentrantLock(name, fair);
    }

    public static void setPolicy(CycleDetectingLockFactory.Policy policy) {
        Threading.policy = policy;
        factory = CycleDetectingLockFactory.newInstance(policy);
    }

    public static CycleDetectingLockFactory.Policy getPolicy() {
        return policy;
    }

    /**
     * Runs a listener callback on its executor. A callback that throws is logged and otherwise ignored, so a
     * faulty listener can never fail the operation that notified it.
     */
    public static void notifyListener(Executor executor, String what, Runnable callback) {
        try {
            executor.execute(() -> {
                try {
                    callback.run();
                } catch (RuntimeException x) {
                    log.warn("{} listener threw an exception, ignoring", what, x);
                }
            });
        } catch (RuntimeException x) {
            log.warn("could not dispatch {} listener", what, x);
        }
    }
}
