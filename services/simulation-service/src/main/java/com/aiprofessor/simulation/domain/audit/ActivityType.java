package com.aiprofessor.simulation.domain.audit;

/** Activity types written by the simulation feature, all in category SIMULATION. */
public enum ActivityType {
    SIMULATION_STARTED("INFO", "Simulation mode started", "Mode simulation démarré"),
    SIMULATION_ENDED("INFO", "Simulation mode ended", "Mode simulation terminé"),
    SIMULATION_WRITE_BLOCKED(
            "WARNING",
            "Write attempt blocked in simulation mode",
            "Tentative de modification bloquée en mode simulation");

    public static final String CATEGORY = "SIMULATION";

    private final String level;
    private final String descriptionEn;
    private final String descriptionFr;

    ActivityType(String level, String descriptionEn, String descriptionFr) {
        this.level = level;
        this.descriptionEn = descriptionEn;
        this.descriptionFr = descriptionFr;
    }

    public String level() {
        return level;
    }

    public String descriptionEn() {
        return descriptionEn;
    }

    public String descriptionFr() {
        return descriptionFr;
    }
}
