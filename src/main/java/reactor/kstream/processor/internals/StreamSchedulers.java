/*
 * Copyright (c) 2023 VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package reactor.kstream.processor.internals;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.Logger;
import reactor.util.Loggers;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Factory methods for the schedulers owned by a stream.
 */
final class StreamSchedulers {

    static final Logger log = Loggers.getLogger(StreamSchedulers.class);

    private StreamSchedulers() {}

    static void defaultUncaughtException(Thread t, Throwable e) {
        log.error("Stream worker " + t.getName() + " failed with an uncaught exception", e);
    }

    /**
     * Scheduler of the background task filling the buffers of a batch cursor.
     */
    static Scheduler newFiller(String streamId) {
        return Schedulers.newSingle(new StreamThreadFactory("filler", streamId));
    }

    /**
     * Scheduler running the commit passes of a stream.
     */
    static Scheduler newCommit(String streamId) {
        return Schedulers.newSingle(new StreamThreadFactory("commit", streamId));
    }

    static boolean isCurrentThreadFromScheduler() {
        return Thread.currentThread() instanceof StreamThreadFactory.StreamThread;
    }

    static final class StreamThreadFactory implements ThreadFactory {

        static final String     PREFIX            = "reactor-kstream-";
        static final AtomicLong COUNTER_REFERENCE = new AtomicLong();

        private final String role;

        private final String streamId;

        StreamThreadFactory(String role, String streamId) {
            this.role = role;
            this.streamId = streamId;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            String newThreadName = PREFIX + role + "-" + streamId + "-" + COUNTER_REFERENCE.incrementAndGet();
            Thread t = new StreamThread(runnable, newThreadName);
            t.setDaemon(true);
            t.setUncaughtExceptionHandler(StreamSchedulers::defaultUncaughtException);
            return t;
        }

        static final class StreamThread extends Thread {

            StreamThread(Runnable target, String name) {
                super(target, name);
            }
        }
    }
}
