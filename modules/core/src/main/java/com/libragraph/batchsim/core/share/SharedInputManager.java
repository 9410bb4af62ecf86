package com.libragraph.batchsim.core.share;

import com.libragraph.batchsim.core.input.InputConstructionException;
import com.libragraph.batchsim.core.input.InputLoader;
import org.jboss.logging.Logger;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns one instance of each shared input object. Objects are constructed on a
 * dedicated owner thread; workers get proxies implementing the loader's object
 * interface, and each call is forwarded to a pool of reader threads so that any
 * number of workers can read concurrently. Results and exceptions go back to the
 * caller.
 * <p>
 * Objects are bound by tag ({@code type + index}, e.g. {@code catalog0}) before they
 * are constructed. Rebuilding a tag replaces its owned instance.
 * <p>
 * Start and stop are idempotent; a failure in either leaves the manager {@code FAILED}.
 */
public class SharedInputManager implements AutoCloseable {

    private static final Logger log = Logger.getLogger(SharedInputManager.class);

    public static final Duration DEFAULT_STARTUP_TIMEOUT = Duration.ofSeconds(10);

    public enum State { STOPPED, RUNNING, FAILED }

    private final ThreadFactory threadFactory;
    private final Duration startupTimeout;
    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);
    private final Map<String, InputLoader<?>> bindings = new ConcurrentHashMap<>();
    private final Map<String, Object> instances = new ConcurrentHashMap<>();

    private volatile ExecutorService owner;
    private volatile ExecutorService readers;
    private volatile Thread ownerThread;

    public SharedInputManager() {
        this(r -> {
            Thread t = new Thread(r, "shared-input-manager");
            t.setDaemon(true);
            return t;
        }, DEFAULT_STARTUP_TIMEOUT);
    }

    public SharedInputManager(ThreadFactory threadFactory, Duration startupTimeout) {
        this.threadFactory = threadFactory;
        this.startupTimeout = startupTimeout;
    }

    public State state() {
        return state.get();
    }

    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    /**
     * Starts the owner thread and waits for it to come up.
     *
     * @throws ManagerStartupException if the thread does not start within the timeout
     */
    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        owner = Executors.newSingleThreadExecutor(threadFactory);
        try {
            ownerThread = owner.submit(Thread::currentThread)
                    .get(startupTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            owner.shutdownNow();
            throw failed(new ManagerStartupException("Interrupted while starting shared input manager", e));
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            owner.shutdownNow();
            throw failed(new ManagerStartupException("Failed to start shared input manager: " + e, e));
        }
        readers = Executors.newCachedThreadPool(threadFactory);
        state.set(State.RUNNING);
        log.infof("Shared input manager running on thread %s", ownerThread.getName());
    }

    public synchronized void stop() throws InterruptedException {
        if (state.get() != State.RUNNING) {
            return;
        }
        state.set(State.STOPPED);
        readers.shutdown();
        owner.shutdown();
        boolean done = owner.awaitTermination(startupTimeout.toMillis(), TimeUnit.MILLISECONDS)
                && readers.awaitTermination(startupTimeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!done) {
            log.warnf("Shared input manager did not stop within %s, interrupting", startupTimeout);
            readers.shutdownNow();
            owner.shutdownNow();
        }
        instances.clear();
        ownerThread = null;
        log.debug("Shared input manager stopped");
    }

    /** Registers the loader that builds the object shared under {@code tag}. */
    public void bind(String tag, InputLoader<?> loader) {
        bindings.put(tag, loader);
        log.debugf("Bound shared input %s -> %s", tag, loader.getClass().getSimpleName());
    }

    public boolean isBound(String tag) {
        return bindings.containsKey(tag);
    }

    /**
     * Builds the object on the owner thread and returns a proxy to it.
     *
     * @throws InputConstructionException if the loader fails
     */
    @SuppressWarnings("unchecked")
    public <T> T construct(String tag, Map<String, Object> kwargs) {
        requireRunning();
        InputLoader<T> loader = (InputLoader<T>) bindings.get(tag);
        if (loader == null) {
            throw new IllegalStateException("No shared input bound to tag " + tag);
        }
        Object real;
        try {
            real = call(owner, () -> loader.construct(kwargs, false));
        } catch (Throwable t) {
            throw new InputConstructionException("Failed to build shared input " + tag + ": " + t.getMessage(), t);
        }
        instances.put(tag, real);
        log.debugf("Built shared input %s", tag);

        Class<T> iface = loader.objectType();
        return iface.cast(Proxy.newProxyInstance(iface.getClassLoader(), new Class<?>[]{iface},
                new ForwardingHandler(this, tag, real)));
    }

    public int instanceCount() {
        return instances.size();
    }

    /** The proxied instance, for identity checks. */
    public Object instance(String tag) {
        return instances.get(tag);
    }

    Object invoke(String tag, Object target, Method method, Object[] args) throws Throwable {
        requireRunning();
        return call(readers, () -> {
            try {
                return method.invoke(target, args);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception ex) throw ex;
                throw e;
            }
        });
    }

    @Override
    public void close() {
        try {
            stop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping shared input manager");
        }
    }

    private ManagerStartupException failed(ManagerStartupException e) {
        state.set(State.FAILED);
        log.errorf("Shared input manager failed: %s", e.getMessage());
        return e;
    }

    private <V> V call(ExecutorService executor, Callable<V> work) throws Throwable {
        if (Thread.currentThread() == ownerThread) {
            return work.call();
        }
        try {
            return executor.submit(work).get();
        } catch (ExecutionException e) {
            throw e.getCause();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    private void requireRunning() {
        if (!isRunning()) {
            throw new IllegalStateException("Shared input manager is " + state());
        }
    }
}
