package org.miniworker.manager;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.miniworker.Main;
import org.miniworker.manager.exceptions.AlreadyRunningException;
import org.miniworker.manager.exceptions.NotRunningException;
import org.miniworker.manager.exceptions.ProcessNotFoundException;
import org.miniworker.manager.exceptions.RegistrationException;
import org.miniworker.manager.exceptions.StartException;
import org.miniworker.manager.exceptions.UnknownWorkerException;
import org.miniworker.monitoring.FileStatusStore;
import org.miniworker.monitoring.StatusSnapshot;
import org.miniworker.monitoring.StatusStore;
import org.miniworker.utils.JsonUtil;
import org.miniworker.worker.WorkerTypeException;
import org.miniworker.worker.WorkerTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

/**
 * Runs registered workers as separate JVM processes and controls them from the
 * outside.
 * <p>
 * Each logical worker name maps to a worker class. A started worker runs under the
 * id {@code worker_manager_<name>}, which keys its status files and pid marker.
 * The manager never talks to a running worker directly: liveness comes from the pid
 * marker checked against the process table, statistics from the status store, and
 * stopping goes through OS signals.
 * <p>
 * Starting and stopping the same name are serialized. A stop can block for the whole
 * grace period, so it holds only the lock of its own name, never the registry's.
 */
public class WorkerManager {
    private static final Logger logger = LoggerFactory.getLogger(WorkerManager.class);

    public static final String UNIQUE_ID_PREFIX = "worker_manager_";
    public static final String RUNNER_MARKER = Main.class.getName();
    public static final String CLASSPATH_ENV = "CLASSPATH";

    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9_.-]+");

    private final ManagerSettings settings;
    private final StatusStore statusStore;
    private final ProcessTable processTable;
    private final ProcessLauncher launcher;
    private final LivenessProbe liveness;

    // name -> worker class, in registration order
    private Map<String, String> registry = new LinkedHashMap<>();
    private final ConcurrentMap<String, Object> nameLocks = new ConcurrentHashMap<>();

    public WorkerManager(ManagerSettings settings) {
        this(settings, new FileStatusStore(settings.statsDir()), new SystemProcessTable(), ProcessLauncher.detached());
    }

    public WorkerManager(ManagerSettings settings, StatusStore statusStore,
                         ProcessTable processTable, ProcessLauncher launcher) {
        this.settings = settings;
        this.statusStore = statusStore;
        this.processTable = processTable;
        this.launcher = launcher;
        this.liveness = new LivenessProbe(statusStore, processTable);
    }

    /**
     * Registers {@code name} for the worker class {@code workerClass}, replacing any
     * previous registration of that name.
     *
     * @throws RegistrationException if the class cannot be loaded or is not a concrete worker
     */
    public synchronized void register(String name, String workerClass) {
        validate(name, workerClass);
        registry.put(name, workerClass);
        logger.info("Registered worker {} -> {}", name, workerClass);
    }

    /**
     * Replaces the whole registry. Nothing changes if any entry is invalid.
     */
    public synchronized void reload(Map<String, String> registrations) {
        Map<String, String> next = new LinkedHashMap<>();
        registrations.forEach((name, workerClass) -> {
            validate(name, workerClass);
            next.put(name, workerClass);
        });
        registry = next;
        logger.info("Worker registry reloaded: {}", next.keySet());
    }

    private void validate(String name, String workerClass) {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new RegistrationException(name, "name must match " + VALID_NAME.pattern());
        }
        try {
            WorkerTypes.resolve(workerClass);
        } catch (WorkerTypeException e) {
            throw new RegistrationException(name, e.getMessage(), e);
        }
    }

    public synchronized boolean isRegistered(String name) {
        return registry.containsKey(name);
    }

    public synchronized List<String> availableWorkers() {
        return new ArrayList<>(registry.keySet());
    }

    public String uniqueId(String name) {
        return UNIQUE_ID_PREFIX + name;
    }

    public long start(String name) {
        return start(name, Map.of());
    }

    /**
     * Launches {@code name} as a new worker process.
     *
     * @return pid of the spawned process
     * @throws UnknownWorkerException  if the name is not registered
     * @throws AlreadyRunningException if a live process owns the worker's pid marker
     * @throws StartException          if the process cannot be spawned
     */
    public long start(String name, Map<String, Object> params) {
        synchronized (lockFor(name)) {
            String workerClass = registeredClass(name);
            if (workerClass == null) {
                throw new UnknownWorkerException(name, availableWorkers());
            }
            String uniqueId = uniqueId(name);
            Optional<Long> livePid = liveness.livePid(uniqueId);
            if (livePid.isPresent()) {
                throw new AlreadyRunningException(name, livePid.get());
            }
            if (liveness.hasStaleMarker(uniqueId)) {
                logger.info("Removing stale pid marker of {}", uniqueId);
                statusStore.removeLivenessMarker(uniqueId);
            }

            try {
                List<String> command = buildCommand(workerClass, uniqueId, params);
                Files.createDirectories(settings.logDir());
                Files.createDirectories(settings.statsDir());
                Process process = launcher.launch(command, workerEnvironment());
                logger.info("Started worker {} as {} (pid {})", name, uniqueId, process.pid());
                return process.pid();
            } catch (IOException e) {
                logger.error("Failed to start worker {}: {}", name, e.getMessage(), e);
                throw new StartException(name, e);
            }
        }
    }

    private synchronized String registeredClass(String name) {
        return registry.get(name);
    }

    private Object lockFor(String name) {
        return nameLocks.computeIfAbsent(name, key -> new Object());
    }

    /**
     * Command line of a managed worker process. Parameters are passed only when
     * there are any.
     * <p>
     * The class path goes through {@link #workerEnvironment()} and the worker id comes
     * right after the runner class: some systems only expose the first page of a
     * process's arguments, and a long class path must not push the id out of it.
     */
    List<String> buildCommand(String workerClass, String uniqueId, Map<String, Object> params)
            throws JsonProcessingException {
        List<String> command = new ArrayList<>();
        command.add(settings.javaExecutable());
        command.add(RUNNER_MARKER);
        command.add("run");
        command.add("--worker-id");
        command.add(uniqueId);
        command.add("--worker-class");
        command.add(workerClass);
        command.add("--log-dir");
        command.add(settings.logDir().toString());
        command.add("--stats-dir");
        command.add(settings.statsDir().toString());
        if (params != null && !params.isEmpty()) {
            command.add("--worker-params");
            command.add(JsonUtil.mapper().writeValueAsString(params));
        }
        return command;
    }

    Map<String, String> workerEnvironment() {
        return Map.of(CLASSPATH_ENV, settings.classpath());
    }

    /**
     * Asks the worker process to exit and kills it if it is still there after the
     * grace period. Blocks for up to that period, and so does a start of the same
     * name issued meanwhile.
     *
     * @return true if the worker exited on its own, false if it had to be killed
     * @throws NotRunningException      if the worker is not alive
     * @throws ProcessNotFoundException if it looks alive but no process carries its id
     */
    public boolean stop(String name) {
        synchronized (lockFor(name)) {
            return stopLocked(name);
        }
    }

    private boolean stopLocked(String name) {
        String uniqueId = uniqueId(name);
        if (!liveness.isAlive(uniqueId)) {
            throw new NotRunningException(name);
        }
        ProcessInfo process = findWorkerProcess(uniqueId)
                .orElseThrow(() -> new ProcessNotFoundException(name, uniqueId));

        long pid = process.pid();
        logger.info("Stopping worker {} (pid {})", name, pid);
        if (!processTable.requestTermination(pid)) {
            logger.warn("Termination request for pid {} was not delivered", pid);
        }
        try {
            if (processTable.awaitExit(pid, settings.stopGrace())) {
                logger.info("Worker {} stopped", name);
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for worker {} to exit", name);
        }
        logger.warn("Worker {} did not exit within {}s, killing pid {}", name, settings.stopGrace().toSeconds(), pid);
        if (!processTable.forceKill(pid)) {
            logger.error("Could not kill pid {} of worker {}", pid, name);
        }
        return false;
    }

    /**
     * Looks for a live process started by this framework for {@code uniqueId}.
     */
    Optional<ProcessInfo> findWorkerProcess(String uniqueId) {
        for (ProcessInfo info : processTable.snapshot()) {
            List<String> args = info.arguments();
            if (args.contains(uniqueId) && args.contains(RUNNER_MARKER)) {
                return Optional.of(info);
            }
        }
        return Optional.empty();
    }

    public boolean isRunning(String name) {
        return liveness.isAlive(uniqueId(name));
    }

    /**
     * Liveness plus last snapshot of {@code name}. Pid and start time of a running
     * worker come from the process table, never from the snapshot.
     */
    public WorkerStatusReport status(String name) {
        String uniqueId = uniqueId(name);
        StatusSnapshot stats = statusStore.read(uniqueId).orElse(null);
        Optional<Long> livePid = liveness.livePid(uniqueId);
        if (livePid.isPresent()) {
            Optional<ProcessInfo> process = findWorkerProcess(uniqueId)
                    .or(() -> processTable.find(livePid.get()));
            if (process.isPresent()) {
                ProcessInfo info = process.get();
                return WorkerStatusReport.running(name, info.pid(), info.startEpochSeconds(), stats);
            }
        }
        return WorkerStatusReport.stopped(name, stats);
    }

    /**
     * {@link #status(String)} of every registered worker, in registration order.
     */
    public Map<String, WorkerStatusReport> statusAll() {
        Map<String, WorkerStatusReport> all = new LinkedHashMap<>();
        for (String name : availableWorkers()) {
            all.put(name, status(name));
        }
        return all;
    }

    public ManagerSettings settings() {
        return settings;
    }
}
