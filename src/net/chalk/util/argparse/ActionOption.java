package net.chalk.util.argparse;

/**
 * A flag that runs an action as soon as it is encountered.
 */
public abstract class ActionOption extends Option<Boolean> {

    public ActionOption(String name, Character shortName, String help) {
        super(name, shortName, help);
    }

    public String getPlaceholder() {
        return null;
    }

    public Boolean process(Boolean previous, String value) {
        return Boolean.TRUE;
    }

    public abstract void run();

}
