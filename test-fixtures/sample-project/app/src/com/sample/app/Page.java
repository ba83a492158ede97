package com.sample.app;

import com.sample.Greeter;

public class Page {

    public String render(String user) {
        return "<h1>" + new Greeter("Welcome").greet(user) + "</h1>";
    }
}
