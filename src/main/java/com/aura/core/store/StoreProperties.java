package com.aura.core.store;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "aura.store")
public class StoreProperties {

    private String backend = "memory";
    private boolean seedSystemObject = true;
    private int threads = 8;
    private int casAttempts = 5;
    private Jdbc jdbc = new Jdbc();

    public String getBackend() { return backend; }
    public void setBackend(String backend) { this.backend = backend; }
    public boolean isSeedSystemObject() { return seedSystemObject; }
    public void setSeedSystemObject(boolean seedSystemObject) { this.seedSystemObject = seedSystemObject; }
    public int getThreads() { return threads; }
    public void setThreads(int threads) { this.threads = threads; }
    public int getCasAttempts() { return casAttempts; }
    public void setCasAttempts(int casAttempts) { this.casAttempts = casAttempts; }
    public Jdbc getJdbc() { return jdbc; }
    public void setJdbc(Jdbc jdbc) { this.jdbc = jdbc; }

    public static class Jdbc {
        private String url = "jdbc:postgresql://localhost:5432/aura";
        private String username = "aura";
        private String password = "";
        private int maxPoolSize = 10;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
    }
}
