package mc.orchestrator.runtime.docker;

final class ShellQuoting {

    private ShellQuoting() {
    }

    static String quote(String value) {
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }
}
