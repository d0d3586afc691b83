package com.rebenew.watchParty.syncserver.core;

/**
 * Fuente de códigos de sala candidatos. La unicidad la garantiza el {@link RoomStore}.
 */
@FunctionalInterface
public interface RoomCodeGenerator {
    String nextCode();
}
