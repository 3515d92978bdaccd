package lodestore.commands.string;

import lodestore.commands.Command;
import lodestore.commands.CommandSupport;
import lodestore.db.LodestoreDatabase;
import lodestore.protocol.RespValue;
import java.util.List;

public class SetCommand implements Command {
    @Override
    public RespValue execute(LodestoreDatabase db, List<byte[]> args) {
        if (args.size() != 3) {
            return CommandSupport.wrongNumberOfArguments(args);
        }

        db.setString(CommandSupport.key(args.get(1)), args.get(2));
        return RespValue.ok();
    }
}
