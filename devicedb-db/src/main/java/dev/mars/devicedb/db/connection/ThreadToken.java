package dev.mars.devicedb.db.connection;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


import java.lang.ref.WeakReference;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Identity of a thread as seen by the connection pool.
 *
 * Each thread receives one token on first use. Token ids come from a process-wide
 * sequence and are never reused, so a connection owned by a thread that has exited
 * can never be mistaken for one owned by a newer thread. Equality is identity.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public final class ThreadToken {
    private static final AtomicLong SEQUENCE = new AtomicLong();
    private static final ThreadLocal<ThreadToken> CURRENT =
        ThreadLocal.withInitial(() -> new ThreadToken(Thread.currentThread()));

    private final long id;
    private final WeakReference<Thread> thread;
    private final String threadName;

    private ThreadToken(Thread thread) {
        this.id = SEQUENCE.incrementAndGet();
        this.thread = new WeakReference<>(thread);
        this.threadName = thread.getName();
    }

    /**
     * Returns the token of the calling thread.
     */
    public static ThreadToken current() {
        return CURRENT.get();
    }

    public long id() {
        return id;
    }

    public String threadName() {
        return threadName;
    }

    /**
     * Whether the thread this token was issued to is still running.
     */
    public boolean isAlive() {
        Thread owner = thread.get();
        return owner != null && owner.isAlive();
    }

    public boolean isCurrentThread() {
        return this == CURRENT.get();
    }

    @Override
    public String toString() {
        return "ThreadToken{" + id + ", '" + threadName + "'}";
    }
}
