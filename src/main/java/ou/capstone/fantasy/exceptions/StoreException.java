package ou.capstone.fantasy.exceptions;

/**
 * A league document is missing, unreadable or inconsistent. Fatal for a run.
 */
public class StoreException extends LeagueException
{
    public StoreException( final String msg )
    {
        super( msg );
    }

    public StoreException( final String msg, final Exception e )
    {
        super( msg, e );
    }
}
