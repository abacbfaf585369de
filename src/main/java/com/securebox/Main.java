package com.securebox;

public class Main {

    public static void main(String[] args) {
        System.exit(new BoxDriver().run(args));
    }
}
