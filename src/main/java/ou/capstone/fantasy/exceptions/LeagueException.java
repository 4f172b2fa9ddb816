package ou.capstone.fantasy.exceptions;

public class LeagueException extends Exception
{
    public LeagueException( final String msg )
    {
        super( msg );
    }

    public LeagueException( final String msg, final Exception e )
    {
        super( msg, e );
    }
}
