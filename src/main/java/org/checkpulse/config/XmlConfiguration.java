package org.checkpulse.config;

import jakarta.xml.bind.annotation.XmlRootElement;

@XmlRootElement(name = "configuration")
public class XmlConfiguration {

    public Checks checks = new Checks();
    public Server server = new Server();

    // --- Check orchestration ---
    @XmlRootElement(name = "checks")
    public static class Checks {
        public String checkfilesDir = "~/.checkpulse";
        public String scriptsDir;
        public int checkRunInterval = 10;
        public long commandTimeoutSeconds = 0;
        public int workerThreads = 0;
        public int historySize = 20;
        public long reloadDebounceMillis = 250;
    }

    // --- Undertow status API ---
    @XmlRootElement(name = "server")
    public static class Server {
        public boolean enabled = false;
        public String host = "127.0.0.1";
        public int port = 7878;
        public int ioThreads = 1;
        public int workerThreads = 4;
        public String basePath = "/api";
        public int ssePushInterval = 5;
    }
}
