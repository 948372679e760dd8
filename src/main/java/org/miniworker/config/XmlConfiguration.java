package org.miniworker.config;

import jakarta.xml.bind.annotation.XmlElement;
import jakarta.xml.bind.annotation.XmlElementWrapper;
import jakarta.xml.bind.annotation.XmlRootElement;

import java.util.ArrayList;
import java.util.List;

@XmlRootElement(name = "configuration")
public class XmlConfiguration {

    public Server server;
    public Manager manager;

    @XmlElementWrapper(name = "workers")
    @XmlElement(name = "worker")
    public List<WorkerEntry> workers = new ArrayList<>();

    // --- Undertow Server ---
    @XmlRootElement(name = "server")
    public static class Server {
        public String host;
        public int port;
        public int ioThreads;
        public int workerThreads;
        public String basePath;
        public String allowedOrigins;
    }

    // --- Worker processes ---
    @XmlRootElement(name = "manager")
    public static class Manager {
        public String logDir;
        public String statsDir;
        public String javaExecutable;
        public String classpath;
        public int stopGraceSeconds;
    }

    @XmlRootElement(name = "worker")
    public static class WorkerEntry {
        public String name;
        public String workerClass;
    }
}
