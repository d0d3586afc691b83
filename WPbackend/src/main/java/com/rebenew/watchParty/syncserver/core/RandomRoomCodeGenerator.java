package com.rebenew.watchParty.syncserver.core;

import java.security.SecureRandom;

// Códigos base 36 en mayúsculas, como "K3X9QZ", fáciles de teclear en el móvil.
public class RandomRoomCodeGenerator implements RoomCodeGenerator {
    private static final char[] ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ".toCharArray();

    private final SecureRandom random = new SecureRandom();
    private final int length;

    public RandomRoomCodeGenerator(int length) {
        if (length < 4) {
            throw new IllegalArgumentException("la longitud del código debe ser al menos 4, recibido " + length);
        }
        this.length = length;
    }

    @Override
    public String nextCode() {
        char[] code = new char[length];
        for (int i = 0; i < length; i++) {
            code[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return new String(code);
    }
}
