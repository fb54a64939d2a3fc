package com.garrison.core.config;

import com.garrison.core.model.SpawnParameters;
import com.garrison.core.model.UnitGroupSpec;
import com.garrison.core.model.WaveDeliveryStrategy;
import com.garrison.core.model.WaveSpec;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for reinforcement coordination. Every default is the value the
 * core uses when no configuration is supplied.
 */
@ConfigurationProperties(prefix = "garrison")
public class GarrisonProperties {

    private Election election = new Election();
    private Combat combat = new Combat();
    private Lifecycle lifecycle = new Lifecycle();
    private Notification notification = new Notification();
    private Spawn spawn = new Spawn();
    private Skill skill = new Skill();
    private List<Wave> waves = defaultWaves();

    // -- Flat accessors (delegate to nested) --
    public long getSettlingDelayMs() { return election.settlingDelayMs; }
    public boolean isFailoverEnabled() { return election.failoverEnabled; }
    public double getDetectionRadius() { return combat.detectionRadius; }
    public int getCheckIntervalSeconds() { return combat.checkIntervalSeconds; }
    public int getWaveCooldownSeconds() { return combat.waveCooldownSeconds; }
    public double getFrontlineRadius() { return lifecycle.frontlineRadius; }
    public int getGracePeriodSeconds() { return lifecycle.gracePeriodSeconds; }
    public WaveDeliveryStrategy getDelivery() { return spawn.delivery; }

    public List<WaveSpec> waveSpecs() {
        return waves.stream().map(Wave::toSpec).toList();
    }

    public Election getElection() { return election; }
    public void setElection(Election election) { this.election = election; }
    public Combat getCombat() { return combat; }
    public void setCombat(Combat combat) { this.combat = combat; }
    public Lifecycle getLifecycle() { return lifecycle; }
    public void setLifecycle(Lifecycle lifecycle) { this.lifecycle = lifecycle; }
    public Notification getNotification() { return notification; }
    public void setNotification(Notification notification) { this.notification = notification; }
    public Spawn getSpawn() { return spawn; }
    public void setSpawn(Spawn spawn) { this.spawn = spawn; }
    public Skill getSkill() { return skill; }
    public void setSkill(Skill skill) { this.skill = skill; }
    public List<Wave> getWaves() { return waves; }
    public void setWaves(List<Wave> waves) { this.waves = waves; }

    public static class Election {
        private long settlingDelayMs = 5000;
        private boolean failoverEnabled = false;

        public long getSettlingDelayMs() { return settlingDelayMs; }
        public void setSettlingDelayMs(long settlingDelayMs) { this.settlingDelayMs = settlingDelayMs; }
        public boolean isFailoverEnabled() { return failoverEnabled; }
        public void setFailoverEnabled(boolean failoverEnabled) { this.failoverEnabled = failoverEnabled; }
    }

    public static class Combat {
        private double detectionRadius = 300.0;
        private int checkIntervalSeconds = 10;
        private int waveCooldownSeconds = 10;

        public double getDetectionRadius() { return detectionRadius; }
        public void setDetectionRadius(double detectionRadius) { this.detectionRadius = detectionRadius; }
        public int getCheckIntervalSeconds() { return checkIntervalSeconds; }
        public void setCheckIntervalSeconds(int checkIntervalSeconds) { this.checkIntervalSeconds = checkIntervalSeconds; }
        public int getWaveCooldownSeconds() { return waveCooldownSeconds; }
        public void setWaveCooldownSeconds(int waveCooldownSeconds) { this.waveCooldownSeconds = waveCooldownSeconds; }
    }

    public static class Lifecycle {
        private double frontlineRadius = 2000.0;
        private int gracePeriodSeconds = 600;
        private int checkIntervalSeconds = 30;

        public double getFrontlineRadius() { return frontlineRadius; }
        public void setFrontlineRadius(double frontlineRadius) { this.frontlineRadius = frontlineRadius; }
        public int getGracePeriodSeconds() { return gracePeriodSeconds; }
        public void setGracePeriodSeconds(int gracePeriodSeconds) { this.gracePeriodSeconds = gracePeriodSeconds; }
        public int getCheckIntervalSeconds() { return checkIntervalSeconds; }
        public void setCheckIntervalSeconds(int checkIntervalSeconds) { this.checkIntervalSeconds = checkIntervalSeconds; }
    }

    public static class Notification {
        private long dispatchDelayMs = 100;
        private String title = "Enemy Reinforcements Detected";
        private String subtitleFormat = "AO: %s";
        private float displaySeconds = 8.0f;

        public long getDispatchDelayMs() { return dispatchDelayMs; }
        public void setDispatchDelayMs(long dispatchDelayMs) { this.dispatchDelayMs = dispatchDelayMs; }
        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }
        public String getSubtitleFormat() { return subtitleFormat; }
        public void setSubtitleFormat(String subtitleFormat) { this.subtitleFormat = subtitleFormat; }
        public float getDisplaySeconds() { return displaySeconds; }
        public void setDisplaySeconds(float displaySeconds) { this.displaySeconds = displaySeconds; }
    }

    public static class Spawn {
        private WaveDeliveryStrategy delivery = WaveDeliveryStrategy.DIRECT_SPAWN;
        private double minSeparation = 5.0;
        private int maxPositionAttempts = 20;
        private Cycle defender = new Cycle(180, 2, 50.0);
        private Cycle attacker = new Cycle(90, 1, 50.0);
        private int reinforcementGroupCount = 2;
        private double reinforcementDispersion = 200.0;

        public WaveDeliveryStrategy getDelivery() { return delivery; }
        public void setDelivery(WaveDeliveryStrategy delivery) { this.delivery = delivery; }
        public double getMinSeparation() { return minSeparation; }
        public void setMinSeparation(double minSeparation) { this.minSeparation = minSeparation; }
        public int getMaxPositionAttempts() { return maxPositionAttempts; }
        public void setMaxPositionAttempts(int maxPositionAttempts) { this.maxPositionAttempts = maxPositionAttempts; }
        public Cycle getDefender() { return defender; }
        public void setDefender(Cycle defender) { this.defender = defender; }
        public Cycle getAttacker() { return attacker; }
        public void setAttacker(Cycle attacker) { this.attacker = attacker; }
        public int getReinforcementGroupCount() { return reinforcementGroupCount; }
        public void setReinforcementGroupCount(int reinforcementGroupCount) { this.reinforcementGroupCount = reinforcementGroupCount; }
        public double getReinforcementDispersion() { return reinforcementDispersion; }
        public void setReinforcementDispersion(double reinforcementDispersion) { this.reinforcementDispersion = reinforcementDispersion; }
    }

    /**
     * Ordinary respawn-cycle parameters of one spawn role.
     */
    public static class Cycle {
        private int respawnSeconds;
        private int groupCount;
        private double dispersion;

        public Cycle() {}

        public Cycle(int respawnSeconds, int groupCount, double dispersion) {
            this.respawnSeconds = respawnSeconds;
            this.groupCount = groupCount;
            this.dispersion = dispersion;
        }

        public SpawnParameters toParameters() {
            return new SpawnParameters(groupCount, dispersion, respawnSeconds, List.of());
        }

        public int getRespawnSeconds() { return respawnSeconds; }
        public void setRespawnSeconds(int respawnSeconds) { this.respawnSeconds = respawnSeconds; }
        public int getGroupCount() { return groupCount; }
        public void setGroupCount(int groupCount) { this.groupCount = groupCount; }
        public double getDispersion() { return dispersion; }
        public void setDispersion(double dispersion) { this.dispersion = dispersion; }
    }

    public static class Skill {
        private int mediumPlayers = 5;
        private int largePlayers = 10;

        public int getMediumPlayers() { return mediumPlayers; }
        public void setMediumPlayers(int mediumPlayers) { this.mediumPlayers = mediumPlayers; }
        public int getLargePlayers() { return largePlayers; }
        public void setLargePlayers(int largePlayers) { this.largePlayers = largePlayers; }
    }

    public static class Wave {
        private int number;
        private int thresholdSeconds;
        private double minRadius = 100.0;
        private double maxRadius = 300.0;
        private List<Group> groups = new ArrayList<>();
        private Group aerial;

        public Wave() {}

        Wave(int number, int thresholdSeconds, double minRadius, double maxRadius, List<Group> groups, Group aerial) {
            this.number = number;
            this.thresholdSeconds = thresholdSeconds;
            this.minRadius = minRadius;
            this.maxRadius = maxRadius;
            this.groups = new ArrayList<>(groups);
            this.aerial = aerial;
        }

        public WaveSpec toSpec() {
            var specs = groups.stream()
                    .map(g -> UnitGroupSpec.ground(g.prefab, g.members))
                    .toList();
            var air = aerial == null ? null : UnitGroupSpec.air(aerial.prefab, aerial.members);
            return new WaveSpec(number, specs, air, minRadius, maxRadius, thresholdSeconds);
        }

        public int getNumber() { return number; }
        public void setNumber(int number) { this.number = number; }
        public int getThresholdSeconds() { return thresholdSeconds; }
        public void setThresholdSeconds(int thresholdSeconds) { this.thresholdSeconds = thresholdSeconds; }
        public double getMinRadius() { return minRadius; }
        public void setMinRadius(double minRadius) { this.minRadius = minRadius; }
        public double getMaxRadius() { return maxRadius; }
        public void setMaxRadius(double maxRadius) { this.maxRadius = maxRadius; }
        public List<Group> getGroups() { return groups; }
        public void setGroups(List<Group> groups) { this.groups = groups; }
        public Group getAerial() { return aerial; }
        public void setAerial(Group aerial) { this.aerial = aerial; }
    }

    public static class Group {
        private String prefab;
        private int members;

        public Group() {}

        Group(String prefab, int members) {
            this.prefab = prefab;
            this.members = members;
        }

        public String getPrefab() { return prefab; }
        public void setPrefab(String prefab) { this.prefab = prefab; }
        public int getMembers() { return members; }
        public void setMembers(int members) { this.members = members; }
    }

    private static List<Wave> defaultWaves() {
        var fireTeam = new Group("Group_FireTeam", 4);
        var rifleSquad = new Group("Group_RifleSquad", 6);
        var mgTeam = new Group("Group_MachineGunTeam", 3);
        var helicopter = new Group("Helicopter_Transport", 2);
        return new ArrayList<>(List.of(
                new Wave(1, 300, 100.0, 300.0, List.of(fireTeam, fireTeam), null),
                new Wave(2, 600, 100.0, 300.0, List.of(rifleSquad, rifleSquad), null),
                new Wave(3, 900, 150.0, 350.0, List.of(rifleSquad, rifleSquad, mgTeam), null),
                new Wave(4, 1200, 200.0, 400.0, List.of(rifleSquad, rifleSquad, rifleSquad), helicopter)
        ));
    }
}
