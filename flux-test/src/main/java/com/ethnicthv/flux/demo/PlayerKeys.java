package com.ethnicthv.flux.demo;

/**
 * Property keys shared by the demo systems and their HUD.
 */
public final class PlayerKeys {

    public static final String HEALTH = "player.health";
    public static final String MAX_HEALTH = "player.maxHealth";
    public static final String SESSION_TIME = "session.time";

    private PlayerKeys() {
    }
}
