package MiddleEnd.IR;

import MiddleEnd.IR.Value.Function;

import java.util.ArrayList;

public class Module {
    private final ArrayList<Function> functions;
    private final String name;
    
    public Module(String name) {
        this.name = name;
        this.functions = new ArrayList<>();
    }

    public String getName() {
        return name;
    }

    public void addFunction(Function function) {
        functions.add(function);
    }

    public ArrayList<Function> functions() {
        return functions;
    }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("; ModuleID = '").append(name).append("'\n");
        for (Function function : functions) {
            sb.append("\n").append(function).append("\n");
        }
        return sb.toString();
    }
}
