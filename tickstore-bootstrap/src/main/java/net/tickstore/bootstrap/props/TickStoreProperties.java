package net.tickstore.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties("tickstore")
public class TickStoreProperties {
    private String zone = "UTC";
    private Delivery delivery = new Delivery();
    private Reminders reminders = new Reminders();
    private Lifecycle runtime = new Lifecycle();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public void setDelivery(Delivery delivery) {
        this.delivery = delivery;
    }

    public Reminders getReminders() {
        return reminders;
    }

    public void setReminders(Reminders reminders) {
        this.reminders = reminders;
    }

    public Lifecycle getRuntime() {
        return runtime;
    }

    public void setRuntime(Lifecycle runtime) {
        this.runtime = runtime;
    }

    public static class Delivery {
        /** Threads used to fan a message out to its recipients. */
        private int parallelism = 8;

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }
    }

    public static class Reminders {
        // six fields, seconds first
        private String whiteDaysCron = "0 0 18 * * *";
        private String dailyHadithCron = "0 0 8 * * *";

        public String getWhiteDaysCron() {
            return whiteDaysCron;
        }

        public void setWhiteDaysCron(String whiteDaysCron) {
            this.whiteDaysCron = whiteDaysCron;
        }

        public String getDailyHadithCron() {
            return dailyHadithCron;
        }

        public void setDailyHadithCron(String dailyHadithCron) {
            this.dailyHadithCron = dailyHadithCron;
        }

        @Override
        public String toString() {
            return "Reminders{" +
                    "whiteDaysCron='" + whiteDaysCron + '\'' +
                    ", dailyHadithCron='" + dailyHadithCron + '\'' +
                    '}';
        }
    }

    public static class Lifecycle {
        /** Start the scheduler engine with the application context. */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
