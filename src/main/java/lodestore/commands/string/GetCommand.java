package lodestore.commands.string;

import lodestore.commands.Command;
import lodestore.commands.CommandSupport;
import lodestore.db.LodestoreDatabase;
import lodestore.protocol.RespValue;
import java.util.List;

public class GetCommand implements Command {
    @Override
    public RespValue execute(LodestoreDatabase db, List<byte[]> args) {
        if (args.size() != 2) {
            return CommandSupport.wrongNumberOfArguments(args);
        }

        // null becomes the null bulk string
        return RespValue.bulkString(db.getString(CommandSupport.key(args.get(1))));
    }
}
