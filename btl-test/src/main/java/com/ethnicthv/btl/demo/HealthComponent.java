package com.ethnicthv.btl.demo;

/**
 * Health pool with passive regeneration.
 */
public class HealthComponent {

    public int currentHealth;
    public int maxHealth;
    public float regenerationRate;
    public boolean isDead;

    private float regenCarry;

    public HealthComponent() {}

    public HealthComponent(int maxHealth, float regenerationRate) {
        if (maxHealth <= 0) throw new IllegalArgumentException("maxHealth must be > 0");
        this.currentHealth = maxHealth;
        this.maxHealth = maxHealth;
        this.regenerationRate = regenerationRate;
        this.isDead = false;
    }

    /** Subtract damage; reaching zero marks the component dead. Negative amounts are ignored. */
    public void damage(int amount) {
        if (amount <= 0 || isDead) return;
        currentHealth = Math.max(0, currentHealth - amount);
        if (currentHealth == 0) isDead = true;
    }

    /** Restore health up to the maximum. Dead components cannot be healed. */
    public void heal(int amount) {
        if (amount <= 0 || isDead) return;
        currentHealth = Math.min(maxHealth, currentHealth + amount);
    }

    /**
     * Apply {@code regenerationRate * deltaTime} health, carrying fractional points over
     * to the next call.
     */
    public void regenerate(float deltaTime) {
        if (isDead || currentHealth >= maxHealth) {
            regenCarry = 0f;
            return;
        }
        regenCarry += regenerationRate * deltaTime;
        int whole = (int) regenCarry;
        if (whole > 0) {
            regenCarry -= whole;
            heal(whole);
        }
    }

    public float fraction() {
        return maxHealth == 0 ? 0f : (float) currentHealth / maxHealth;
    }

    @Override
    public String toString() {
        return String.format("Health(%d/%d, regen=%.2f, dead=%s)",
                currentHealth, maxHealth, regenerationRate, isDead);
    }
}
