package ou.capstone.fantasy.exceptions;

/**
 * A scheduled tournament could not be matched to an event on the results website.
 */
public class EventNotFoundException extends LeagueException
{
    private final String query;

    public EventNotFoundException( final String query )
    {
        super( "No event found for '" + query + "'" );
        this.query = query;
    }

    public String getQuery()
    {
        return query;
    }
}
