package com.ethnicthv.btl.demo;

import com.ethnicthv.btl.core.suite.TestSuite;
import com.ethnicthv.btl.core.suite.annotation.DescribeClass;

@DescribeClass(HealthComponent.class)
public final class HealthComponentSuite extends TestSuite<HealthComponent> {

    public HealthComponentSuite() {
        super(HealthComponent.class, "Health");

        describeTest("HealthComponent", "constructed with a maximum", "start at full health and alive", () -> {
            HealthComponent h = new HealthComponent(100, 1f);
            assertAreEqual(h.currentHealth, 100);
            assertAreEqual(h.maxHealth, 100);
            assertIsFalse(h.isDead);
        });

        describeTest("damage", "the amount is below current health", "subtract it", () -> {
            HealthComponent h = new HealthComponent(100, 0f);
            h.damage(30);
            assertAreEqual(h.currentHealth, 70);
            assertAreEqual(h.fraction(), 0.7f);
        });

        describeTest("damage", "the amount exceeds current health", "clamp to zero and die", () -> {
            HealthComponent h = new HealthComponent(50, 0f);
            h.damage(80);
            assertAreEqual(h.currentHealth, 0);
            assertIsTrue(h.isDead);
        });

        describeTest("damage", "the amount is negative", "leave health unchanged", () -> {
            HealthComponent h = new HealthComponent(50, 0f);
            h.damage(-10);
            assertAreEqual(h.currentHealth, 50);
        });

        describeTest("heal", "healing past the maximum", "cap at the maximum", () -> {
            HealthComponent h = new HealthComponent(100, 0f);
            h.damage(10);
            h.heal(50);
            assertAreEqual(h.currentHealth, 100);
        });

        describeTest("heal", "the component is dead", "have no effect", () -> {
            HealthComponent h = new HealthComponent(10, 0f);
            h.damage(10);
            h.heal(5);
            assertAreEqual(h.currentHealth, 0);
            assertIsTrue(h.isDead);
        });

        describeTest("regenerate", "the rate yields fractional points", "carry the fraction to the next tick", () -> {
            HealthComponent h = new HealthComponent(100, 2.5f);
            h.damage(20);
            h.regenerate(1f);
            assertAreEqual(h.currentHealth, 82);
            h.regenerate(1f);
            assertAreEqual(h.currentHealth, 85);
        });
    }
}
